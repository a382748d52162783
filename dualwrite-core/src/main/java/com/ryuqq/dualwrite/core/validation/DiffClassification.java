package com.ryuqq.dualwrite.core.validation;

/**
 * 두 스토어 간 엔티티 상태 비교 결과 분류.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum DiffClassification {

    /** 패리티 필드가 모두 일치 (또는 양쪽 모두 없음). */
    MATCH,

    /** 양쪽에 존재하지만 하나 이상의 패리티 필드가 다름. */
    VALUE_MISMATCH,

    /** 레거시에만 존재. primary 스캔으로는 발견되지 않음. */
    MISSING_IN_PRIMARY,

    /** 신규 스토어에만 존재. */
    MISSING_IN_SECONDARY;

    public boolean isMismatch() {
        return this != MATCH;
    }

    /**
     * 재조정(repair) 대상 분류인지 확인.
     *
     * @return MISSING_IN_SECONDARY 또는 VALUE_MISMATCH이면 true
     */
    public boolean isRepairable() {
        return this == MISSING_IN_SECONDARY || this == VALUE_MISMATCH;
    }
}
