package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.application.retry.RetryQueue;
import com.ryuqq.dualwrite.application.status.DualWriteStatus;
import com.ryuqq.dualwrite.application.status.StatusProvider;
import com.ryuqq.dualwrite.core.outcome.OverallStatus;

import java.util.OptionalLong;

/**
 * 메트릭과 재시도 큐로부터 상태 스냅샷을 만드는 StatusProvider 구현체.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class DualWriteStatusService implements StatusProvider {

    private final DualWriteMetrics metrics;
    private final RetryQueue retryQueue;

    public DualWriteStatusService(DualWriteMetrics metrics, RetryQueue retryQueue) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (retryQueue == null) {
            throw new IllegalArgumentException("retryQueue cannot be null");
        }
        this.metrics = metrics;
        this.retryQueue = retryQueue;
    }

    @Override
    public DualWriteStatus snapshot() {
        OptionalLong oldestAge = retryQueue.oldestPendingAgeMillis();
        return new DualWriteStatus(
            metrics.operationCount(OverallStatus.SUCCESS),
            metrics.operationCount(OverallStatus.PARTIAL_SUCCESS),
            metrics.operationCount(OverallStatus.FAILED),
            retryQueue.depth(),
            oldestAge.isPresent() ? oldestAge.getAsLong() : null,
            metrics.resolvedRetryCount(),
            metrics.abandonedRetryCount(),
            metrics.lastValidationCompletedAt(),
            metrics.lastValidationMismatchCount(),
            metrics.validationErrorCount()
        );
    }
}
