package com.ryuqq.dualwrite.core.outcome;

import com.ryuqq.dualwrite.core.model.OperationId;

import java.util.Optional;

/**
 * 이중 쓰기 작업의 구조화된 결과.
 *
 * <p>하나의 primary 결과와 0~1개의 secondary 결과를 가집니다.
 * secondary 쓰기가 설정으로 비활성화되었거나 재시도 큐로 지연된 경우 secondary 결과는 없습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>primary가 FAILED이면 overall은 항상 FAILED</li>
 *   <li>PARTIAL_SUCCESS이면 secondary 결과가 존재하며 FAILED</li>
 *   <li>secondaryDeferred이면 secondary 결과 없음</li>
 * </ul>
 *
 * @param operationId 작업 ID
 * @param overall 전체 결과
 * @param primary primary 스토어 결과
 * @param secondary secondary 스토어 결과 (null 가능)
 * @param secondaryDeferred secondary 쓰기가 재시도 큐로 넘겨졌는지 여부
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record DualWriteResult(
    OperationId operationId,
    OverallStatus overall,
    WriteOutcome primary,
    WriteOutcome secondary,
    boolean secondaryDeferred
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식 위반 시
     */
    public DualWriteResult {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (overall == null) {
            throw new IllegalArgumentException("overall cannot be null");
        }
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (primary.store() != StoreRole.PRIMARY) {
            throw new IllegalArgumentException("primary outcome must target PRIMARY (current: " + primary.store() + ")");
        }
        if (secondary != null && secondary.store() != StoreRole.SECONDARY) {
            throw new IllegalArgumentException("secondary outcome must target SECONDARY (current: " + secondary.store() + ")");
        }
        if (primary.isFailed() && overall != OverallStatus.FAILED) {
            throw new IllegalArgumentException("overall must be FAILED when primary failed (current: " + overall + ")");
        }
        if (overall == OverallStatus.PARTIAL_SUCCESS && (secondary == null || !secondary.isFailed())) {
            throw new IllegalArgumentException("PARTIAL_SUCCESS requires a failed secondary outcome");
        }
        if (secondaryDeferred && secondary != null) {
            throw new IllegalArgumentException("deferred secondary cannot carry an outcome");
        }
    }

    public Optional<WriteOutcome> secondaryOutcome() {
        return Optional.ofNullable(secondary);
    }

    public boolean isSuccess() {
        return overall == OverallStatus.SUCCESS;
    }

    public boolean isPartialSuccess() {
        return overall == OverallStatus.PARTIAL_SUCCESS;
    }

    public boolean isFailed() {
        return overall == OverallStatus.FAILED;
    }

    /**
     * 결과를 실패로 만든 스토어.
     *
     * @return 실패 원인 스토어 (성공이면 empty)
     */
    public Optional<StoreRole> failedStore() {
        if (primary.isFailed()) {
            return Optional.of(StoreRole.PRIMARY);
        }
        if (secondary != null && secondary.isFailed()) {
            return Optional.of(StoreRole.SECONDARY);
        }
        return Optional.empty();
    }
}
