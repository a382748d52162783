package com.ryuqq.dualwrite.core.validation;

/**
 * 하나의 패리티 필드 불일치.
 *
 * @param field primary 기준 필드명
 * @param primaryValue primary 값 (null 가능)
 * @param secondaryValue secondary 값 (null 가능)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record FieldDifference(String field, Object primaryValue, Object secondaryValue) {

    public FieldDifference {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
    }
}
