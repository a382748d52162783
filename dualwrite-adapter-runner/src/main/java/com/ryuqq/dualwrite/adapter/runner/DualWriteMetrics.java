package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.application.retry.RetryQueue;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.OverallStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dual-Write 엔진 메트릭.
 *
 * <p>Micrometer {@link MeterRegistry}에 카운터와 게이지를 등록하고,
 * 상태 조회({@link DualWriteStatusService})가 읽을 수 있도록 현재 값을 노출합니다.</p>
 *
 * <p><strong>등록 메트릭:</strong></p>
 * <ul>
 *   <li>dualwrite.operations{overall} (counter)</li>
 *   <li>dualwrite.retry.resolved / dualwrite.retry.abandoned (counter)</li>
 *   <li>dualwrite.validation.passes / dualwrite.validation.errors (counter)</li>
 *   <li>dualwrite.validation.mismatches (gauge, 마지막 검증 패스 기준)</li>
 *   <li>dualwrite.retry.depth (gauge, {@link #bindRetryQueue(RetryQueue)} 이후)</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class DualWriteMetrics {

    private static final long NO_VALIDATION = -1L;

    private final MeterRegistry registry;
    private final Map<OverallStatus, Counter> operationCounters;
    private final Counter retryResolvedCounter;
    private final Counter retryAbandonedCounter;
    private final Counter validationPassCounter;
    private final Counter validationErrorCounter;
    private final AtomicLong lastValidationMismatches = new AtomicLong();
    private final AtomicLong lastValidationCompletedAt = new AtomicLong(NO_VALIDATION);

    /**
     * SimpleMeterRegistry로 생성.
     */
    public DualWriteMetrics() {
        this(new SimpleMeterRegistry());
    }

    /**
     * @param registry 메트릭 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public DualWriteMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;

        this.operationCounters = new EnumMap<>(OverallStatus.class);
        for (OverallStatus status : OverallStatus.values()) {
            operationCounters.put(status, Counter.builder("dualwrite.operations")
                .description("Completed dual-write operations by overall status")
                .tag("overall", status.name())
                .register(registry));
        }
        this.retryResolvedCounter = Counter.builder("dualwrite.retry.resolved")
            .description("Retry tasks resolved by a successful secondary write")
            .register(registry);
        this.retryAbandonedCounter = Counter.builder("dualwrite.retry.abandoned")
            .description("Retry tasks abandoned after exhausting max attempts")
            .register(registry);
        this.validationPassCounter = Counter.builder("dualwrite.validation.passes")
            .description("Completed validation sweeps")
            .register(registry);
        this.validationErrorCounter = Counter.builder("dualwrite.validation.errors")
            .description("Validation sweeps aborted by store read failures")
            .register(registry);
        Gauge.builder("dualwrite.validation.mismatches", lastValidationMismatches, AtomicLong::get)
            .description("Mismatches found by the last validation sweep")
            .register(registry);
    }

    /**
     * 재시도 큐 깊이 게이지 등록.
     *
     * @param retryQueue 관찰할 재시도 큐
     */
    public void bindRetryQueue(RetryQueue retryQueue) {
        if (retryQueue == null) {
            throw new IllegalArgumentException("retryQueue cannot be null");
        }
        Gauge.builder("dualwrite.retry.depth", retryQueue, RetryQueue::depth)
            .description("Pending retry tasks")
            .register(registry);
    }

    public void recordOperation(DualWriteResult result) {
        operationCounters.get(result.overall()).increment();
    }

    public void recordRetryResolved() {
        retryResolvedCounter.increment();
    }

    public void recordRetryAbandoned() {
        retryAbandonedCounter.increment();
    }

    /**
     * 검증 패스 완료 기록.
     *
     * @param completedAt 완료 시각 (epoch millis)
     * @param mismatchCount 해당 패스에서 발견된 불일치 수
     */
    public void recordValidationPass(long completedAt, long mismatchCount) {
        lastValidationMismatches.set(mismatchCount);
        lastValidationCompletedAt.set(completedAt);
        validationPassCounter.increment();
    }

    public void recordValidationError() {
        validationErrorCounter.increment();
    }

    public long operationCount(OverallStatus overall) {
        return (long) operationCounters.get(overall).count();
    }

    public long resolvedRetryCount() {
        return (long) retryResolvedCounter.count();
    }

    public long abandonedRetryCount() {
        return (long) retryAbandonedCounter.count();
    }

    public long validationPassCount() {
        return (long) validationPassCounter.count();
    }

    public long validationErrorCount() {
        return (long) validationErrorCounter.count();
    }

    /**
     * @return 마지막 검증 완료 시각, 검증 전이면 null
     */
    public Long lastValidationCompletedAt() {
        long value = lastValidationCompletedAt.get();
        return value == NO_VALIDATION ? null : value;
    }

    public long lastValidationMismatchCount() {
        return lastValidationMismatches.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
