package com.ryuqq.dualwrite.core.validation;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Payload;

import java.util.List;
import java.util.Optional;

/**
 * 한 엔티티에 대한 두 스토어 비교 보고.
 *
 * <p>검증기만 생성하며, 권위 있는 상태로 저장되지 않는 보고용 데이터입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>MISSING_IN_PRIMARY: primaryValue 없음, secondaryValue 존재</li>
 *   <li>MISSING_IN_SECONDARY: primaryValue 존재, secondaryValue 없음</li>
 *   <li>VALUE_MISMATCH: 양쪽 존재, differences 1개 이상</li>
 *   <li>MATCH: differences 없음</li>
 * </ul>
 *
 * @param ref 대상 엔티티
 * @param primaryValue primary 스냅샷 (null 가능)
 * @param secondaryValue secondary 스냅샷 (null 가능)
 * @param classification 분류
 * @param differences 불일치 필드 목록
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record DiffRecord(
    EntityRef ref,
    Payload primaryValue,
    Payload secondaryValue,
    DiffClassification classification,
    List<FieldDifference> differences
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 분류와 스냅샷이 일치하지 않는 경우
     */
    public DiffRecord {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (classification == null) {
            throw new IllegalArgumentException("classification cannot be null");
        }
        differences = differences == null ? List.of() : List.copyOf(differences);
        boolean consistent = switch (classification) {
            case MATCH -> differences.isEmpty();
            case VALUE_MISMATCH -> primaryValue != null && secondaryValue != null && !differences.isEmpty();
            case MISSING_IN_PRIMARY -> primaryValue == null && secondaryValue != null;
            case MISSING_IN_SECONDARY -> primaryValue != null && secondaryValue == null;
        };
        if (!consistent) {
            throw new IllegalArgumentException("Snapshots do not match classification " + classification + " for " + ref);
        }
    }

    public static DiffRecord match(EntityRef ref, Payload primaryValue, Payload secondaryValue) {
        return new DiffRecord(ref, primaryValue, secondaryValue, DiffClassification.MATCH, List.of());
    }

    public static DiffRecord mismatch(EntityRef ref, Payload primaryValue, Payload secondaryValue,
                                      List<FieldDifference> differences) {
        return new DiffRecord(ref, primaryValue, secondaryValue, DiffClassification.VALUE_MISMATCH, differences);
    }

    public static DiffRecord missingInPrimary(EntityRef ref, Payload secondaryValue) {
        return new DiffRecord(ref, null, secondaryValue, DiffClassification.MISSING_IN_PRIMARY, List.of());
    }

    public static DiffRecord missingInSecondary(EntityRef ref, Payload primaryValue) {
        return new DiffRecord(ref, primaryValue, null, DiffClassification.MISSING_IN_SECONDARY, List.of());
    }

    public Optional<Payload> primarySnapshot() {
        return Optional.ofNullable(primaryValue);
    }

    public Optional<Payload> secondarySnapshot() {
        return Optional.ofNullable(secondaryValue);
    }

    public boolean isMatch() {
        return classification == DiffClassification.MATCH;
    }
}
