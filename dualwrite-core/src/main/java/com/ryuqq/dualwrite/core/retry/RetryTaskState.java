package com.ryuqq.dualwrite.core.retry;

/**
 * 재시도 작업의 생명주기 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING ──(재시도 N회)──→ PENDING
 *    │
 *    ├──→ RESOLVED   (secondary 쓰기 성공)
 *    ├──→ ABANDONED  (max_attempts 소진)
 *    └──→ CANCELLED  (운영자 취소)
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum RetryTaskState {

    PENDING,

    RESOLVED,

    ABANDONED,

    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return PENDING이 아니면 true
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}
