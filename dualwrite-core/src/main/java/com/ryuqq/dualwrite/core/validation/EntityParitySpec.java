package com.ryuqq.dualwrite.core.validation;

import com.ryuqq.dualwrite.core.model.EntityType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 엔티티 종류별 일관성 비교 선언.
 *
 * <p>두 스토어의 스키마가 동일하다고 가정하지 않으므로, 비교는 여기 선언된
 * 패리티 필드로 제한됩니다. 선언되지 않은 필드(신규 스토어의 추가 필드, 타임스탬프 등)는 무시합니다.</p>
 *
 * <p><strong>숫자 허용 오차:</strong> 두 숫자의 차이가 numericTolerance 이하이면 같은 값으로 봅니다.
 * 기본값 0.005는 소수 둘째 자리 반올림 후 비교와 같은 효과를 냅니다 (통화 값).</p>
 *
 * <pre>
 * EntityParitySpec.builder("product")
 *     .field("name")
 *     .field("price")
 *     .field("stockQuantity", "stock_quantity")
 *     .build();
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class EntityParitySpec {

    public static final BigDecimal DEFAULT_NUMERIC_TOLERANCE = new BigDecimal("0.005");

    private final EntityType entityType;
    private final List<ParityField> fields;
    private final BigDecimal numericTolerance;

    private EntityParitySpec(EntityType entityType, List<ParityField> fields, BigDecimal numericTolerance) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("At least one parity field is required for " + entityType.getValue());
        }
        if (numericTolerance == null || numericTolerance.signum() < 0) {
            throw new IllegalArgumentException(
                "numericTolerance must be non-negative (current: " + numericTolerance + ")"
            );
        }
        Set<String> names = new HashSet<>();
        for (ParityField field : fields) {
            if (!names.add(field.primaryName())) {
                throw new IllegalArgumentException("Duplicate parity field: " + field.primaryName());
            }
        }
        this.entityType = entityType;
        this.fields = List.copyOf(fields);
        this.numericTolerance = numericTolerance;
    }

    public static Builder builder(String entityType) {
        return new Builder(EntityType.of(entityType));
    }

    public static Builder builder(EntityType entityType) {
        return new Builder(entityType);
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public List<ParityField> getFields() {
        return fields;
    }

    public BigDecimal getNumericTolerance() {
        return numericTolerance;
    }

    @Override
    public String toString() {
        return "EntityParitySpec{" + entityType.getValue() + ", fields=" + fields.size() + '}';
    }

    /**
     * EntityParitySpec 빌더.
     */
    public static final class Builder {

        private final EntityType entityType;
        private final List<ParityField> fields = new ArrayList<>();
        private BigDecimal numericTolerance = DEFAULT_NUMERIC_TOLERANCE;

        private Builder(EntityType entityType) {
            this.entityType = entityType;
        }

        public Builder field(String name) {
            fields.add(ParityField.same(name));
            return this;
        }

        /**
         * 스토어마다 이름이 다른 필드 등록.
         *
         * @param primaryName 신규 스토어 필드명
         * @param secondaryName 레거시 스토어 필드명
         * @return this
         */
        public Builder field(String primaryName, String secondaryName) {
            fields.add(new ParityField(primaryName, secondaryName));
            return this;
        }

        public Builder numericTolerance(BigDecimal numericTolerance) {
            this.numericTolerance = numericTolerance;
            return this;
        }

        public EntityParitySpec build() {
            return new EntityParitySpec(entityType, fields, numericTolerance);
        }
    }
}
