package com.ryuqq.dualwrite.core.validation;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 비교 보고 목록의 요약.
 *
 * <p><strong>계산 항목:</strong></p>
 * <ul>
 *   <li>total / matches: 전체 및 일치 건수</li>
 *   <li>mismatchesByClassification: MATCH를 제외한 분류별 건수</li>
 *   <li>syncPercentage: matches / total × 100 (total이 0이면 0.0)</li>
 *   <li>fieldDifferenceCounts: 필드별 불일치 건수</li>
 *   <li>commonIssues: 불일치가 가장 많은 필드 상위 10개</li>
 * </ul>
 *
 * @param total 전체 건수
 * @param matches 일치 건수
 * @param mismatchesByClassification 분류별 불일치 건수
 * @param syncPercentage 동기화 비율 (%)
 * @param fieldDifferenceCounts 필드별 불일치 건수
 * @param commonIssues 상위 불일치 필드
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record DiffSummary(
    int total,
    int matches,
    Map<DiffClassification, Integer> mismatchesByClassification,
    double syncPercentage,
    Map<String, Integer> fieldDifferenceCounts,
    List<String> commonIssues
) {

    static final int COMMON_ISSUE_LIMIT = 10;

    public DiffSummary {
        if (mismatchesByClassification == null || fieldDifferenceCounts == null || commonIssues == null) {
            throw new IllegalArgumentException("summary components cannot be null");
        }
        Map<DiffClassification, Integer> byClassification = new EnumMap<>(DiffClassification.class);
        byClassification.putAll(mismatchesByClassification);
        mismatchesByClassification = Collections.unmodifiableMap(byClassification);
        fieldDifferenceCounts = Collections.unmodifiableMap(new LinkedHashMap<>(fieldDifferenceCounts));
        commonIssues = List.copyOf(commonIssues);
    }

    /**
     * 비교 보고 목록을 요약.
     *
     * @param diffs 비교 보고 목록
     * @return 요약
     * @throws IllegalArgumentException diffs가 null인 경우
     */
    public static DiffSummary of(List<DiffRecord> diffs) {
        if (diffs == null) {
            throw new IllegalArgumentException("diffs cannot be null");
        }
        int matches = 0;
        Map<DiffClassification, Integer> byClassification = new EnumMap<>(DiffClassification.class);
        Map<String, Integer> fieldCounts = new LinkedHashMap<>();
        for (DiffRecord diff : diffs) {
            if (diff.isMatch()) {
                matches++;
                continue;
            }
            byClassification.merge(diff.classification(), 1, Integer::sum);
            for (FieldDifference difference : diff.differences()) {
                fieldCounts.merge(difference.field(), 1, Integer::sum);
            }
        }
        return from(diffs.size(), matches, byClassification, fieldCounts);
    }

    /**
     * 비교 대상이 없는 빈 요약.
     *
     * @return 빈 요약
     */
    public static DiffSummary empty() {
        return from(0, 0, Map.of(), Map.of());
    }

    /**
     * 두 요약을 합산. 페이지 단위 요약을 누적할 때 사용합니다.
     *
     * @param other 더할 요약
     * @return 합산된 요약
     * @throws IllegalArgumentException other가 null인 경우
     */
    public DiffSummary plus(DiffSummary other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        Map<DiffClassification, Integer> byClassification = new EnumMap<>(DiffClassification.class);
        byClassification.putAll(mismatchesByClassification);
        other.mismatchesByClassification.forEach((classification, count) ->
            byClassification.merge(classification, count, Integer::sum));
        Map<String, Integer> fieldCounts = new LinkedHashMap<>(fieldDifferenceCounts);
        other.fieldDifferenceCounts.forEach((field, count) -> fieldCounts.merge(field, count, Integer::sum));
        return from(total + other.total, matches + other.matches, byClassification, fieldCounts);
    }

    private static DiffSummary from(int total, int matches,
                                    Map<DiffClassification, Integer> byClassification,
                                    Map<String, Integer> fieldCounts) {
        double percentage = total == 0 ? 0.0 : (matches * 100.0) / total;
        List<String> common = fieldCounts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(COMMON_ISSUE_LIMIT)
            .map(Map.Entry::getKey)
            .toList();
        return new DiffSummary(total, matches, byClassification, percentage, fieldCounts, common);
    }

    public int mismatches() {
        return total - matches;
    }

    public int count(DiffClassification classification) {
        if (classification == DiffClassification.MATCH) {
            return matches;
        }
        return mismatchesByClassification.getOrDefault(classification, 0);
    }
}
