package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.validation.EntityParitySpec;
import com.ryuqq.dualwrite.core.validation.FieldDifference;
import com.ryuqq.dualwrite.core.validation.ParityField;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 패리티 필드 단위 payload 비교기.
 *
 * <p>두 스토어는 스키마가 같다고 가정하지 않으므로, {@link EntityParitySpec}에 등록된
 * 필드만 (이름 변경 반영) 정규화한 뒤 비교합니다.</p>
 *
 * <p><strong>정규화 규칙:</strong></p>
 * <ul>
 *   <li>null과 필드 없음은 같음</li>
 *   <li>문자열은 앞뒤 공백 제거</li>
 *   <li>숫자는 BigDecimal로 변환, 차이가 허용 오차 이하이면 같음</li>
 *   <li>시각 값과 ISO-8601 문자열은 초 단위로 절삭 (offset 없는 값은 UTC)</li>
 *   <li>Map과 List는 같은 규칙으로 재귀 비교</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class PayloadComparator {

    private static final Pattern ISO_TIMESTAMP = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}.*");
    private static final Pattern ZONE_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");

    /**
     * 패리티 필드 비교.
     *
     * @param spec 엔티티 타입의 패리티 필드 정의
     * @param primary primary 스토어 값
     * @param secondary secondary 스토어 값
     * @return 서로 다른 필드 목록 (primary 필드명 기준, 같으면 빈 목록)
     */
    public List<FieldDifference> compare(EntityParitySpec spec, Payload primary, Payload secondary) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (primary == null || secondary == null) {
            throw new IllegalArgumentException("payloads cannot be null");
        }
        List<FieldDifference> differences = new ArrayList<>();
        for (ParityField field : spec.getFields()) {
            Object primaryValue = primary.get(field.primaryName());
            Object secondaryValue = secondary.get(field.secondaryName());
            if (!equivalent(primaryValue, secondaryValue, spec.getNumericTolerance())) {
                differences.add(new FieldDifference(field.primaryName(), primaryValue, secondaryValue));
            }
        }
        return differences;
    }

    /**
     * 정규화 후 두 값이 같은지 판단.
     *
     * @param left 값
     * @param right 값
     * @param tolerance 숫자 허용 오차
     * @return 같으면 true
     */
    public boolean equivalent(Object left, Object right, BigDecimal tolerance) {
        return normalizedEquals(normalize(left), normalize(right), tolerance);
    }

    static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            Instant timestamp = ISO_TIMESTAMP.matcher(trimmed).matches() ? parseTimestamp(trimmed) : null;
            return timestamp != null ? timestamp : trimmed;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? BigDecimal.valueOf(number) : value;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof Instant instant) {
            return instant.truncatedTo(ChronoUnit.SECONDS);
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant().truncatedTo(ChronoUnit.SECONDS);
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant().truncatedTo(ChronoUnit.SECONDS);
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
        }
        if (value instanceof Date date) {
            return date.toInstant().truncatedTo(ChronoUnit.SECONDS);
        }
        if (value instanceof Payload payload) {
            return normalize(payload.getFields());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object normalizedValue = normalize(entry.getValue());
                if (normalizedValue != null) {
                    normalized.put(String.valueOf(entry.getKey()), normalizedValue);
                }
            }
            return normalized;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> normalized = new ArrayList<>(collection.size());
            for (Object element : collection) {
                normalized.add(normalize(element));
            }
            return normalized;
        }
        return value;
    }

    private static Instant parseTimestamp(String text) {
        String iso = text.replace(' ', 'T');
        try {
            Instant instant = ZONE_SUFFIX.matcher(iso).find()
                ? OffsetDateTime.parse(iso).toInstant()
                : LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
            return instant.truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean normalizedEquals(Object left, Object right, BigDecimal tolerance) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof BigDecimal a && right instanceof BigDecimal b) {
            return a.subtract(b).abs().compareTo(tolerance) <= 0;
        }
        if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
            Set<Object> keys = new HashSet<>(a.keySet());
            keys.addAll(b.keySet());
            for (Object key : keys) {
                if (!normalizedEquals(a.get(key), b.get(key), tolerance)) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!normalizedEquals(a.get(i), b.get(i), tolerance)) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }
}
