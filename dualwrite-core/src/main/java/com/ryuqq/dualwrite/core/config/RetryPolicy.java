package com.ryuqq.dualwrite.core.config;

/**
 * secondary 쓰기 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 동기 경로의 최초 시도 포함 (기본 5)</li>
 *   <li>baseDelayMs: 지수 백오프 기본 지연 (기본 1000ms)</li>
 *   <li>maxDelayMs: 최대 지연 (기본 300000ms = 5분)</li>
 *   <li>jitterFactor: 지터 비율 0.0~1.0 (기본 0.1)</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 지연 (밀리초, 양수)
 * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
 * @param jitterFactor 지터 비율 (0.0 ~ 1.0)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=5, baseDelayMs=1000, maxDelayMs=300000, jitterFactor=0.1</p>
     */
    public RetryPolicy() {
        this(5, 1000, 300000, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (current: " + maxDelayMs + " < " + baseDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
