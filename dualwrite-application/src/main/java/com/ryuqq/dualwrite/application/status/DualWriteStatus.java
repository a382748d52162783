package com.ryuqq.dualwrite.application.status;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time status of the engine, consumed by a service's detailed health check.
 *
 * @param successCount operations that returned SUCCESS
 * @param partialSuccessCount operations that returned PARTIAL_SUCCESS
 * @param failedCount operations that returned FAILED
 * @param retryQueueDepth pending retry tasks
 * @param oldestPendingRetryAgeMillis age of the oldest pending retry, null when the queue is empty
 * @param resolvedRetryCount retry tasks resolved by the drain loop
 * @param abandonedRetryCount retry tasks abandoned after max attempts
 * @param lastValidationCompletedAt epoch millis of the last completed validation pass, null before the first
 * @param lastValidationMismatchCount mismatches found by the last completed pass
 * @param validationErrorCount entity types whose validation failed with a read error
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record DualWriteStatus(
    long successCount,
    long partialSuccessCount,
    long failedCount,
    int retryQueueDepth,
    Long oldestPendingRetryAgeMillis,
    long resolvedRetryCount,
    long abandonedRetryCount,
    Long lastValidationCompletedAt,
    long lastValidationMismatchCount,
    long validationErrorCount
) {

    public long totalOperations() {
        return successCount + partialSuccessCount + failedCount;
    }

    /**
     * Whether the engine needs operator attention.
     *
     * @return true if any retry was abandoned or the last validation pass found drift
     */
    public boolean isDegraded() {
        return abandonedRetryCount > 0 || lastValidationMismatchCount > 0;
    }

    /**
     * Flat view for JSON health endpoints.
     *
     * @return ordered map of status fields
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", successCount);
        map.put("partialSuccess", partialSuccessCount);
        map.put("failed", failedCount);
        map.put("retryQueueDepth", retryQueueDepth);
        map.put("oldestPendingRetryAgeMillis", oldestPendingRetryAgeMillis);
        map.put("resolvedRetries", resolvedRetryCount);
        map.put("abandonedRetries", abandonedRetryCount);
        map.put("lastValidationCompletedAt", lastValidationCompletedAt);
        map.put("lastValidationMismatches", lastValidationMismatchCount);
        map.put("validationErrors", validationErrorCount);
        map.put("status", isDegraded() ? "degraded" : "healthy");
        return map;
    }
}
