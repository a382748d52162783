package com.ryuqq.dualwrite.core.validation;

/**
 * 비교 대상 필드 하나와 스토어별 필드명.
 *
 * @param primaryName 신규 스토어 필드명
 * @param secondaryName 레거시 스토어 필드명 (이름이 바뀐 경우 다름)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record ParityField(String primaryName, String secondaryName) {

    public ParityField {
        if (primaryName == null || primaryName.isBlank()) {
            throw new IllegalArgumentException("primaryName cannot be null or blank");
        }
        if (secondaryName == null || secondaryName.isBlank()) {
            throw new IllegalArgumentException("secondaryName cannot be null or blank");
        }
    }

    public static ParityField same(String name) {
        return new ParityField(name, name);
    }

    public boolean isRenamed() {
        return !primaryName.equals(secondaryName);
    }
}
