package com.ryuqq.dualwrite.application.validation;

/**
 * 재조정 요청에 대해 수행된 조치.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum RepairAction {

    /** primary의 현재 값을 secondary에 다시 기록함. */
    REWRITTEN,

    /** primary에서 사라진 엔티티를 secondary에서도 삭제함. */
    DELETED,

    /** 재조정 대상이 아닌 분류 (MATCH, MISSING_IN_PRIMARY). */
    NOT_APPLICABLE,

    /** secondary 쓰기가 실패함. */
    FAILED
}
