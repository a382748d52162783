package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.adapter.runner.KeyedLeaseManager.Lease;
import com.ryuqq.dualwrite.application.coordinator.DualWriteCoordinator;
import com.ryuqq.dualwrite.application.retry.RetryQueue;
import com.ryuqq.dualwrite.core.config.DualWriteConfig;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.OverallStatus;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteErrorCode;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;
import com.ryuqq.dualwrite.core.spi.LedgerEntry;
import com.ryuqq.dualwrite.core.spi.StoreAdapter;
import com.ryuqq.dualwrite.core.spi.WriteLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 키 단위 직렬화 Dual-Write Coordinator 구현체.
 *
 * <p>한 작업을 primary(신규) 스토어와 secondary(레거시) 스토어에 적용하고,
 * 결과를 원장에 기록합니다. 같은 키에 대한 작업은 {@link KeyedLeaseManager}로 직렬화됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(op)
 *   ↓
 * 1. lease 획득 (entityType, entityKey)
 * 2. 원장 조회: 완료된 같은 operationId → 캐시된 결과 반환
 * 3. 원장 entry open
 * 4. primary 쓰기 → 실패 시 FAILED 반환 (secondary 쓰기 없음)
 * 5. secondary:
 *    - 비활성 → SUCCESS
 *    - asyncLegacy 또는 키에 대기 중인 재시도 존재 → RetryQueue 등록 (deferred)
 *    - 동기 쓰기 실패 → RetryQueue 등록 + PARTIAL_SUCCESS (failOnLegacyError면 FAILED)
 *    - 재시도 등록 자체가 실패하면 secondary 실패로 흡수 (PARTIAL_SUCCESS)
 * 6. 원장 complete, 메트릭 기록, lease 해제
 * </pre>
 *
 * <p><strong>레거시 단독 모드 (writeToNew=false):</strong> primary는 SKIPPED로 기록하고
 * secondary에 동기로 쓰며, 그 결과가 곧 전체 결과입니다. 재시도는 등록하지 않습니다.</p>
 *
 * <p>호출 간 상태를 갖지 않으므로 동시 호출에 안전합니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class SerializedDualWriteCoordinator implements DualWriteCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SerializedDualWriteCoordinator.class);

    private final DualWriteConfig config;
    private final StoreAdapter primaryStore;
    private final StoreAdapter secondaryStore;
    private final WriteLedger ledger;
    private final RetryQueue retryQueue;
    private final KeyedLeaseManager leaseManager;
    private final StoreInvoker storeInvoker;
    private final DualWriteMetrics metrics;

    /**
     * 생성자.
     *
     * @param config dual-write 설정
     * @param primaryStore 신규 스토어 어댑터
     * @param secondaryStore 레거시 스토어 어댑터
     * @param ledger 쓰기 원장
     * @param retryQueue secondary 재시도 큐
     * @param leaseManager 키 단위 직렬화기 (재시도 큐, 검증기와 공유해야 함)
     * @param storeInvoker 타임아웃 적용 호출기
     * @param metrics 메트릭
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SerializedDualWriteCoordinator(DualWriteConfig config,
                                          StoreAdapter primaryStore,
                                          StoreAdapter secondaryStore,
                                          WriteLedger ledger,
                                          RetryQueue retryQueue,
                                          KeyedLeaseManager leaseManager,
                                          StoreInvoker storeInvoker,
                                          DualWriteMetrics metrics) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (primaryStore == null) {
            throw new IllegalArgumentException("primaryStore cannot be null");
        }
        if (secondaryStore == null) {
            throw new IllegalArgumentException("secondaryStore cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (retryQueue == null) {
            throw new IllegalArgumentException("retryQueue cannot be null");
        }
        if (leaseManager == null) {
            throw new IllegalArgumentException("leaseManager cannot be null");
        }
        if (storeInvoker == null) {
            throw new IllegalArgumentException("storeInvoker cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }

        this.config = config;
        this.primaryStore = primaryStore;
        this.secondaryStore = secondaryStore;
        this.ledger = ledger;
        this.retryQueue = retryQueue;
        this.leaseManager = leaseManager;
        this.storeInvoker = storeInvoker;
        this.metrics = metrics;
    }

    /**
     * {@inheritDoc}
     *
     * <p>원장 entry를 연 뒤에는 예외가 발생해도 entry를 완료 처리한 다음 예외를 전파합니다.
     * 열린 채로 남은 entry는 같은 operationId의 재제출을 영구히 막기 때문입니다.</p>
     *
     * @throws IllegalArgumentException operation이 null인 경우
     * @throws IllegalStateException 같은 operationId가 아직 처리 중(미완료)인 경우
     */
    @Override
    public DualWriteResult execute(Operation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        OperationId operationId = operation.operationId();

        try (Lease lease = leaseManager.acquire(operation.ref())) {
            // 1. 멱등성: 완료된 같은 작업은 재실행하지 않음
            Optional<DualWriteResult> cached = cachedResult(operationId);
            if (cached.isPresent()) {
                log.debug("Duplicate submission of {}, returning cached result {}", operationId, cached.get().overall());
                return cached.get();
            }
            if (!ledger.open(operation)) {
                throw new IllegalStateException("Operation " + operationId + " is already being executed");
            }

            // 2. 쓰기
            DualWriteResult result;
            try {
                result = config.legacyOnly()
                    ? executeLegacyOnly(operation, lease)
                    : executeDual(operation, lease);
            } catch (RuntimeException e) {
                abort(operation, e);
                throw e;
            }

            // 3. 기록
            ledger.complete(operationId, result);
            metrics.recordOperation(result);
            logCompletion(operation, result);
            return result;
        }
    }

    private Optional<DualWriteResult> cachedResult(OperationId operationId) {
        Optional<LedgerEntry> existing = ledger.find(operationId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        if (!existing.get().isCompleted()) {
            throw new IllegalStateException("Operation " + operationId + " is already being executed");
        }
        return existing.get().completedResult();
    }

    private DualWriteResult executeDual(Operation operation, Lease lease) {
        OperationId operationId = operation.operationId();

        // 1. primary
        WriteOutcome primary = write(lease, primaryStore, StoreRole.PRIMARY, operation);
        ledger.append(operationId, primary);

        if (primary.isFailed()) {
            log.error("Primary write failed for {} {} {}: [{}] {}",
                operation.kind(), operation.ref(), operationId, primary.errorCode(), primary.error());
            return new DualWriteResult(operationId, OverallStatus.FAILED, primary, null, false);
        }

        if (!config.secondaryWritesEnabled()) {
            return new DualWriteResult(operationId, OverallStatus.SUCCESS, primary, null, false);
        }

        // 2. secondary 지연: 비동기 모드이거나 앞선 재시도가 남아 있으면 순서 유지를 위해 큐 뒤에 등록
        if (config.asyncLegacy() || retryQueue.hasPending(operation.ref())) {
            Optional<String> enqueueError = enqueueRetry(operation, 0, null);
            if (enqueueError.isEmpty()) {
                return new DualWriteResult(operationId, OverallStatus.SUCCESS, primary, null, true);
            }
            // secondary 쓰기는 시도되지 않았고 재시도도 보장되지 않음
            WriteOutcome secondary = WriteOutcome.failed(operationId, StoreRole.SECONDARY, WriteErrorCode.STORE_ERROR,
                "Secondary write not dispatched: " + enqueueError.get(), storeInvoker.getClock().millis(), 0, 1);
            ledger.append(operationId, secondary);
            return new DualWriteResult(operationId, secondaryFailureStatus(), primary, secondary, false);
        }

        // 3. secondary 동기 쓰기
        WriteOutcome secondary = write(lease, secondaryStore, StoreRole.SECONDARY, operation);
        if (!secondary.isFailed()) {
            ledger.append(operationId, secondary);
            return new DualWriteResult(operationId, OverallStatus.SUCCESS, primary, secondary, false);
        }

        log.warn("Secondary write failed for {} {} {}, queued for retry: [{}] {}",
            operation.kind(), operation.ref(), operationId, secondary.errorCode(), secondary.error());
        Optional<String> enqueueError = enqueueRetry(operation, 1, secondary.error());
        if (enqueueError.isPresent()) {
            secondary = WriteOutcome.failed(operationId, StoreRole.SECONDARY, secondary.errorCode(),
                secondary.error() + "; " + enqueueError.get(),
                secondary.attemptedAt(), secondary.durationMillis(), secondary.attempt());
        }
        ledger.append(operationId, secondary);
        return new DualWriteResult(operationId, secondaryFailureStatus(), primary, secondary, false);
    }

    private DualWriteResult executeLegacyOnly(Operation operation, Lease lease) {
        OperationId operationId = operation.operationId();

        WriteOutcome primary = WriteOutcome.skipped(operationId, StoreRole.PRIMARY, null,
            "Primary writes disabled", storeInvoker.getClock().millis());
        ledger.append(operationId, primary);

        WriteOutcome secondary = write(lease, secondaryStore, StoreRole.SECONDARY, operation);
        ledger.append(operationId, secondary);

        if (secondary.isFailed()) {
            log.error("Legacy write failed in legacy-only mode for {} {} {}: [{}] {}",
                operation.kind(), operation.ref(), operationId, secondary.errorCode(), secondary.error());
            return new DualWriteResult(operationId, OverallStatus.FAILED, primary, secondary, false);
        }
        return new DualWriteResult(operationId, OverallStatus.SUCCESS, primary, secondary, false);
    }

    private WriteOutcome write(Lease lease, StoreAdapter store, StoreRole role, Operation operation) {
        StoreCall call = storeInvoker.write(store, role, operation.ref(), operation.kind(), operation.payload());
        // 타임아웃 후에도 실행 중이면 같은 키의 다음 쓰기가 이 호출 뒤에 오도록 묶음
        lease.holdUntil(call.inFlight());
        return call.toOutcome(operation.operationId(), role, 1);
    }

    private OverallStatus secondaryFailureStatus() {
        return config.failOnLegacyError() ? OverallStatus.FAILED : OverallStatus.PARTIAL_SUCCESS;
    }

    /**
     * 재시도 등록. 저장 실패는 secondary 쪽 실패로 흡수합니다.
     *
     * @return 등록 실패 시 오류 설명
     */
    private Optional<String> enqueueRetry(Operation operation, int attemptsMade, String lastError) {
        try {
            retryQueue.enqueue(operation, attemptsMade, lastError);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Failed to record retry task for {} {} {}, secondary store will not converge automatically",
                operation.kind(), operation.ref(), operation.operationId(), e);
            return Optional.of("retry task could not be recorded (" + e + ")");
        }
    }

    /**
     * 예기치 못한 예외로 중단된 작업의 원장 entry를 FAILED로 완료합니다.
     */
    private void abort(Operation operation, RuntimeException cause) {
        OperationId operationId = operation.operationId();
        log.error("Dual write {} {} {} aborted", operation.kind(), operation.ref(), operationId, cause);
        WriteOutcome primary = WriteOutcome.failed(operationId, StoreRole.PRIMARY, WriteErrorCode.STORE_ERROR,
            "Execution aborted: " + cause, storeInvoker.getClock().millis(), 0, 1);
        DualWriteResult result = new DualWriteResult(operationId, OverallStatus.FAILED, primary, null, false);
        try {
            ledger.complete(operationId, result);
            metrics.recordOperation(result);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private void logCompletion(Operation operation, DualWriteResult result) {
        if (config.logAllOperations()) {
            log.info("Dual write {} {} {} -> {} (secondaryDeferred={})",
                operation.kind(), operation.ref(), operation.operationId(), result.overall(), result.secondaryDeferred());
        } else {
            log.debug("Dual write {} {} {} -> {}",
                operation.kind(), operation.ref(), operation.operationId(), result.overall());
        }
    }

    public DualWriteConfig getConfig() {
        return config;
    }
}
