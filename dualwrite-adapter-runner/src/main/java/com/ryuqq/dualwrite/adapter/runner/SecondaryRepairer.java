package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.adapter.runner.KeyedLeaseManager.Lease;
import com.ryuqq.dualwrite.application.retry.RetryQueue;
import com.ryuqq.dualwrite.application.validation.RepairAction;
import com.ryuqq.dualwrite.application.validation.RepairResult;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.OverallStatus;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;
import com.ryuqq.dualwrite.core.spi.StoreAdapter;
import com.ryuqq.dualwrite.core.spi.WriteLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Secondary 스토어 복구 (Reconciliation).
 *
 * <p>primary의 현재 값을 secondary에 다시 적용하여 drift를 제거합니다.
 * 실시간 쓰기와 경합하지 않도록 Coordinator와 같은 {@link KeyedLeaseManager}를 사용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>lease 획득</li>
 *   <li>키에 대기 중인 재시도가 있으면 복구하지 않음 (재시도가 순서대로 수렴시킴)</li>
 *   <li>primary 재조회: 있으면 UPDATE(upsert), 없으면 DELETE</li>
 *   <li>원장에 복구 작업 기록 (primary는 SKIPPED)</li>
 * </ol>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class SecondaryRepairer {

    private static final Logger log = LoggerFactory.getLogger(SecondaryRepairer.class);

    private final StoreAdapter primaryStore;
    private final StoreAdapter secondaryStore;
    private final WriteLedger ledger;
    private final RetryQueue retryQueue;
    private final KeyedLeaseManager leaseManager;
    private final StoreInvoker storeInvoker;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SecondaryRepairer(StoreAdapter primaryStore,
                             StoreAdapter secondaryStore,
                             WriteLedger ledger,
                             RetryQueue retryQueue,
                             KeyedLeaseManager leaseManager,
                             StoreInvoker storeInvoker) {
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
        this.primaryStore = primaryStore;
        this.secondaryStore = secondaryStore;
        this.ledger = ledger;
        this.retryQueue = retryQueue;
        this.leaseManager = leaseManager;
        this.storeInvoker = storeInvoker;
    }

    /**
     * primary의 현재 값으로 secondary 복구.
     *
     * @param ref 대상 엔티티
     * @return 복구 결과
     * @throws com.ryuqq.dualwrite.core.validation.StoreReadException primary 조회 실패 시
     */
    public RepairResult repair(EntityRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }

        try (Lease lease = leaseManager.acquire(ref)) {
            // 1. 대기 중인 재시도가 있으면 그쪽이 최신 값을 순서대로 반영함
            if (retryQueue.hasPending(ref)) {
                log.info("Skipping repair of {}: pending retries will converge it", ref);
                return RepairResult.notApplicable(ref);
            }

            // 2. primary 재조회
            Optional<Payload> current = storeInvoker.read(primaryStore, StoreRole.PRIMARY, ref);
            OperationKind kind = current.isPresent() ? OperationKind.UPDATE : OperationKind.DELETE;
            long now = storeInvoker.getClock().millis();
            Operation repair = new Operation(OperationId.generate(), ref, kind, current.orElse(Payload.empty()), now);
            OperationId operationId = repair.operationId();

            // 3. secondary 쓰기 + 원장 기록
            ledger.open(repair);
            WriteOutcome primary = WriteOutcome.skipped(operationId, StoreRole.PRIMARY, null,
                "Repair targets the secondary store only", now);
            ledger.append(operationId, primary);

            StoreCall call = storeInvoker.write(secondaryStore, StoreRole.SECONDARY, ref, kind, repair.payload());
            lease.holdUntil(call.inFlight());
            WriteOutcome secondary = call.toOutcome(operationId, StoreRole.SECONDARY, 1);
            ledger.append(operationId, secondary);

            OverallStatus overall = secondary.isFailed() ? OverallStatus.FAILED : OverallStatus.SUCCESS;
            ledger.complete(operationId, new DualWriteResult(operationId, overall, primary, secondary, false));

            if (secondary.isFailed()) {
                log.warn("Repair of {} failed: [{}] {}", ref, secondary.errorCode(), secondary.error());
                return new RepairResult(ref, RepairAction.FAILED, operationId, secondary);
            }
            RepairAction action = kind == OperationKind.DELETE ? RepairAction.DELETED : RepairAction.REWRITTEN;
            log.info("Repaired {} in secondary store: {} ({})", ref, action, operationId);
            return new RepairResult(ref, action, operationId, secondary);
        }
    }
}
