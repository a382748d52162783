package com.ryuqq.dualwrite.adapter.runner;

/**
 * RetryQueueRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: drain 주기 (기본 1000ms)</li>
 *   <li>batchSize: 한 번의 pump에서 시도할 최대 태스크 수 (기본 100)</li>
 *   <li>abandonedHistorySize: 조회용으로 보관할 최근 포기 태스크 수 (기본 100)</li>
 * </ul>
 *
 * <p>재시도 횟수와 백오프는 {@link com.ryuqq.dualwrite.core.config.RetryPolicy}가 결정합니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 * @param pollIntervalMs drain 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param abandonedHistorySize 포기 이력 보관 수 (0 이상이어야 함)
 */
public record RetryQueueConfig(
    long pollIntervalMs,
    int batchSize,
    int abandonedHistorySize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=1000ms, batchSize=100, abandonedHistorySize=100</p>
     */
    public RetryQueueConfig() {
        this(1000, 100, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryQueueConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (abandonedHistorySize < 0) {
            throw new IllegalArgumentException(
                "abandonedHistorySize must be non-negative (current: " + abandonedHistorySize + ")"
            );
        }
    }

    public RetryQueueConfig withPollIntervalMs(long pollIntervalMs) {
        return new RetryQueueConfig(pollIntervalMs, batchSize, abandonedHistorySize);
    }

    public RetryQueueConfig withBatchSize(int batchSize) {
        return new RetryQueueConfig(pollIntervalMs, batchSize, abandonedHistorySize);
    }

    public RetryQueueConfig withAbandonedHistorySize(int abandonedHistorySize) {
        return new RetryQueueConfig(pollIntervalMs, batchSize, abandonedHistorySize);
    }
}
