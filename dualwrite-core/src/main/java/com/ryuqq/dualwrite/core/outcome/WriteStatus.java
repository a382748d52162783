package com.ryuqq.dualwrite.core.outcome;

/**
 * 단일 스토어 쓰기 시도의 결과 상태.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum WriteStatus {

    /** 스토어에 반영됨 (멱등 삭제 no-op 포함). */
    SUCCESS,

    /** 스토어 오류, 타임아웃 또는 중복 키. */
    FAILED,

    /** 설정 또는 운영자 취소로 의도적으로 시도하지 않음. */
    SKIPPED
}
