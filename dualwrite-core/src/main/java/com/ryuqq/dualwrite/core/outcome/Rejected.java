package com.ryuqq.dualwrite.core.outcome;

/**
 * 스토어가 쓰기를 거부하거나 실패함.
 *
 * @param errorCode 실패 사유 코드
 * @param message 오류 메시지
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record Rejected(WriteErrorCode errorCode, String message) implements StoreResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode가 null이거나 message가 비어있는 경우
     */
    public Rejected {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
