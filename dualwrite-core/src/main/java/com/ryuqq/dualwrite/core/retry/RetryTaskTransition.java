package com.ryuqq.dualwrite.core.retry;

/**
 * 재시도 작업 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → PENDING (재시도 후 다음 시도 예약)</li>
 *   <li>PENDING → RESOLVED</li>
 *   <li>PENDING → ABANDONED</li>
 *   <li>PENDING → CANCELLED</li>
 * </ul>
 *
 * <p>종료 상태에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class RetryTaskTransition {

    private RetryTaskTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 종료 상태에서 전이하려는 경우
     */
    public static void validate(RetryTaskState from, RetryTaskState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s -> %s", from, to)
            );
        }
    }
}
