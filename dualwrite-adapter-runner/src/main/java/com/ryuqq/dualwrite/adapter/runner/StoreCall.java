package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.outcome.NotFound;
import com.ryuqq.dualwrite.core.outcome.Rejected;
import com.ryuqq.dualwrite.core.outcome.StoreResult;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * 시간 측정이 포함된 스토어 쓰기 호출 결과.
 *
 * @param result 스토어 결과
 * @param startedAt 호출 시작 시각 (epoch millis)
 * @param durationMillis 소요 시간 (밀리초)
 * @param inFlight 타임아웃 후에도 어댑터 호출이 아직 실행 중이면 그 종료 신호, 끝났으면 null
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record StoreCall(StoreResult result, long startedAt, long durationMillis, CompletableFuture<Void> inFlight) {

    public StoreCall {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }

    public StoreCall(StoreResult result, long startedAt, long durationMillis) {
        this(result, startedAt, durationMillis, null);
    }

    /**
     * 호출 결과는 이미 반환되었지만 어댑터 호출이 아직 끝나지 않았는지 여부.
     *
     * <p>인터럽트를 무시하는 드라이버는 타임아웃 뒤에도 쓰기를 반영할 수 있으므로,
     * 같은 키의 다음 쓰기는 이 호출이 끝날 때까지 기다려야 합니다.</p>
     */
    public boolean isStillRunning() {
        return inFlight != null && !inFlight.isDone();
    }

    /**
     * 원장에 기록할 WriteOutcome으로 변환.
     *
     * <ul>
     *   <li>Written → SUCCESS</li>
     *   <li>NotFound → SUCCESS (no-op)</li>
     *   <li>Rejected → FAILED (errorCode, message 유지)</li>
     * </ul>
     *
     * @param operationId 작업 ID
     * @param store 대상 스토어
     * @param attempt 시도 번호
     * @return WriteOutcome
     */
    public WriteOutcome toOutcome(OperationId operationId, StoreRole store, int attempt) {
        if (result instanceof Rejected rejected) {
            return WriteOutcome.failed(operationId, store, rejected.errorCode(), rejected.message(),
                startedAt, durationMillis, attempt);
        }
        if (result instanceof NotFound) {
            return WriteOutcome.noOp(operationId, store, startedAt, durationMillis, attempt);
        }
        return WriteOutcome.success(operationId, store, startedAt, durationMillis, attempt);
    }
}
