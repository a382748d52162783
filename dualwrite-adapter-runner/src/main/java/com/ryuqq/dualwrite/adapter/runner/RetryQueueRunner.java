package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.adapter.runner.KeyedLeaseManager.Lease;
import com.ryuqq.dualwrite.application.retry.RetryQueue;
import com.ryuqq.dualwrite.application.runtime.Runtime;
import com.ryuqq.dualwrite.core.config.RetryPolicy;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteErrorCode;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;
import com.ryuqq.dualwrite.core.retry.RetryTask;
import com.ryuqq.dualwrite.core.retry.RetryTaskState;
import com.ryuqq.dualwrite.core.spi.RetryTaskStore;
import com.ryuqq.dualwrite.core.spi.StoreAdapter;
import com.ryuqq.dualwrite.core.spi.WriteLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Secondary 재시도 큐 Runner 구현체.
 *
 * <p>실패(또는 지연)된 secondary 쓰기를 {@link RetryTaskStore}에 보관하고,
 * {@link #pump()} 주기마다 만기된 태스크를 레거시 스토어에 다시 적용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * findAllPending() → sequence 순서
 *   ↓
 * For each 키의 가장 오래된 태스크 (만기된 것만, batchSize까지):
 *   1. lease 획득
 *   2. 재시도 (CREATE 재시도는 UPDATE로 재생)
 *   3. 결과 처리:
 *      - 성공 → 태스크 제거 + SECONDARY 성공 outcome 기록
 *      - 실패 (maxAttempts 미만) → attemptCount 증가 + backoff 재예약
 *      - 실패 (maxAttempts 도달) → 포기 + RETRIES_EXHAUSTED outcome 기록 + ERROR 로그
 * </pre>
 *
 * <p><strong>순서 보장:</strong> 한 키에서 가장 낮은 sequence의 태스크만 시도하므로,
 * 같은 키의 secondary 쓰기는 제출 순서대로 적용됩니다.</p>
 *
 * <p><strong>재시작:</strong> 태스크의 내구성은 주입된 {@link RetryTaskStore}를 따릅니다.
 * 원장에 entry가 없는 복구 태스크는 태스크 내용으로 entry를 다시 엽니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class RetryQueueRunner implements RetryQueue, Runtime {

    private static final Logger log = LoggerFactory.getLogger(RetryQueueRunner.class);

    private final RetryTaskStore taskStore;
    private final StoreAdapter secondaryStore;
    private final WriteLedger ledger;
    private final KeyedLeaseManager leaseManager;
    private final StoreInvoker storeInvoker;
    private final RetryPolicy policy;
    private final BackoffCalculator backoffCalculator;
    private final RetryQueueConfig config;
    private final DualWriteMetrics metrics;
    private final Clock clock;
    private final Deque<RetryTask> abandonedHistory = new ArrayDeque<>();

    /**
     * 생성자 (정책 기반 BackoffCalculator 사용).
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryQueueRunner(RetryTaskStore taskStore,
                            StoreAdapter secondaryStore,
                            WriteLedger ledger,
                            KeyedLeaseManager leaseManager,
                            StoreInvoker storeInvoker,
                            RetryPolicy policy,
                            RetryQueueConfig config,
                            DualWriteMetrics metrics) {
        this(taskStore, secondaryStore, ledger, leaseManager, storeInvoker, policy, config, metrics,
            new BackoffCalculator(policy));
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param taskStore 재시도 태스크 저장소
     * @param secondaryStore 레거시 스토어 어댑터
     * @param ledger 쓰기 원장
     * @param leaseManager 키 단위 직렬화기 (Coordinator와 공유)
     * @param storeInvoker 타임아웃 적용 호출기
     * @param policy 재시도 정책 (maxAttempts)
     * @param config drain 설정
     * @param metrics 메트릭
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryQueueRunner(RetryTaskStore taskStore,
                            StoreAdapter secondaryStore,
                            WriteLedger ledger,
                            KeyedLeaseManager leaseManager,
                            StoreInvoker storeInvoker,
                            RetryPolicy policy,
                            RetryQueueConfig config,
                            DualWriteMetrics metrics,
                            BackoffCalculator backoffCalculator) {
        if (taskStore == null) {
            throw new IllegalArgumentException("taskStore cannot be null");
        }
        if (secondaryStore == null) {
            throw new IllegalArgumentException("secondaryStore cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (leaseManager == null) {
            throw new IllegalArgumentException("leaseManager cannot be null");
        }
        if (storeInvoker == null) {
            throw new IllegalArgumentException("storeInvoker cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }

        this.taskStore = taskStore;
        this.secondaryStore = secondaryStore;
        this.ledger = ledger;
        this.leaseManager = leaseManager;
        this.storeInvoker = storeInvoker;
        this.policy = policy;
        this.config = config;
        this.metrics = metrics;
        this.backoffCalculator = backoffCalculator;
        this.clock = storeInvoker.getClock();
    }

    // ==================== RetryQueue ====================

    /**
     * {@inheritDoc}
     *
     * <p>attemptsMade가 0이면 즉시 만기, 그 외에는 backoff 후 만기됩니다.
     * 이미 maxAttempts에 도달했다면 저장하지 않고 바로 포기 처리합니다.</p>
     */
    @Override
    public RetryTask enqueue(Operation operation, int attemptsMade, String lastError) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (attemptsMade < 0) {
            throw new IllegalArgumentException("attemptsMade must be non-negative (current: " + attemptsMade + ")");
        }

        long now = clock.millis();
        if (attemptsMade >= policy.maxAttempts()) {
            RetryTask task = RetryTask.pending(operation, taskStore.nextSequence(), attemptsMade, now, now, lastError);
            return abandon(task, attemptsMade, lastError);
        }

        long nextAttemptAt = attemptsMade == 0 ? now : now + backoffCalculator.calculate(attemptsMade);
        RetryTask task = RetryTask.pending(operation, taskStore.nextSequence(), attemptsMade, nextAttemptAt, now, lastError);
        taskStore.save(task);
        log.debug("Retry task enqueued: {} {} seq={} attempts={} nextAttemptAt={}",
            task.operationId(), task.ref(), task.sequence(), attemptsMade, nextAttemptAt);
        return task;
    }

    @Override
    public void enqueue(RetryTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (task.state() != RetryTaskState.PENDING) {
            throw new IllegalArgumentException("Only PENDING tasks can be enqueued (current: " + task.state() + ")");
        }
        taskStore.save(task);
    }

    @Override
    public boolean hasPending(EntityRef ref) {
        return taskStore.hasPending(ref);
    }

    /**
     * {@inheritDoc}
     *
     * <p>취소된 작업의 원장에는 SKIPPED(CANCELLED) secondary outcome이 추가됩니다.</p>
     */
    @Override
    public boolean cancel(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        Optional<RetryTask> candidate = taskStore.find(operationId);
        if (candidate.isEmpty()) {
            return false;
        }

        try (Lease lease = leaseManager.acquire(candidate.get().ref())) {
            // lease 대기 중 해결되었을 수 있음
            Optional<RetryTask> current = taskStore.find(operationId);
            if (current.isEmpty() || !taskStore.remove(operationId)) {
                return false;
            }
            RetryTask task = current.get();
            ensureLedgerEntry(task);
            ledger.append(operationId, WriteOutcome.skipped(operationId, StoreRole.SECONDARY,
                WriteErrorCode.CANCELLED, "Cancelled by operator", clock.millis()));
            log.warn("Retry task cancelled: {} {} after {} attempt(s)", operationId, task.ref(), task.attemptCount());
            return true;
        }
    }

    @Override
    public int cancelAll(EntityType entityType) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        int cancelled = 0;
        for (RetryTask task : taskStore.findByEntityType(entityType)) {
            if (cancel(task.operationId())) {
                cancelled++;
            }
        }
        log.warn("Cancelled {} pending retry task(s) for entity type {}", cancelled, entityType.getValue());
        return cancelled;
    }

    @Override
    public int depth() {
        return taskStore.size();
    }

    @Override
    public OptionalLong oldestPendingAgeMillis() {
        long now = clock.millis();
        return taskStore.findAllPending().stream()
            .mapToLong(RetryTask::createdAt)
            .min()
            .stream()
            .map(createdAt -> Math.max(0, now - createdAt))
            .findFirst();
    }

    @Override
    public List<RetryTask> pending() {
        return taskStore.findAllPending();
    }

    @Override
    public List<RetryTask> abandoned() {
        synchronized (abandonedHistory) {
            return List.copyOf(abandonedHistory);
        }
    }

    // ==================== Runtime ====================

    /**
     * 만기된 태스크를 키마다 하나씩, 최대 batchSize개 재시도합니다.
     *
     * <p>개별 태스크 처리 중 예외는 로그 후 다음 태스크로 진행합니다.</p>
     */
    @Override
    public void pump() {
        long now = clock.millis();
        List<RetryTask> pending = taskStore.findAllPending();
        Set<EntityRef> visitedKeys = new HashSet<>();
        int attempted = 0;

        for (RetryTask task : pending) {
            if (attempted >= config.batchSize()) {
                break;
            }
            // 키의 head 태스크만 대상 (뒤 태스크는 앞 태스크가 끝날 때까지 대기)
            if (!visitedKeys.add(task.ref())) {
                continue;
            }
            if (!task.isDue(now)) {
                continue;
            }
            attempted++;
            try {
                attempt(task.operationId(), task.ref());
            } catch (Exception e) {
                log.error("Error while retrying secondary write for {} {}", task.operationId(), task.ref(), e);
            }
        }
    }

    private void attempt(OperationId operationId, EntityRef ref) {
        try (Lease lease = leaseManager.acquire(ref)) {
            // 1. lease 대기 중 취소/해결되었는지 재확인
            Optional<RetryTask> current = taskStore.find(operationId);
            if (current.isEmpty()) {
                return;
            }
            RetryTask task = current.get();
            ensureLedgerEntry(task);

            // 2. 재시도 (첫 시도가 반영되었을 수 있으므로 CREATE는 upsert로 재생)
            int attempt = task.attemptCount() + 1;
            OperationKind kind = task.kind() == OperationKind.CREATE && task.attemptCount() > 0
                ? OperationKind.UPDATE
                : task.kind();
            StoreCall call = storeInvoker.write(secondaryStore, StoreRole.SECONDARY, task.ref(), kind, task.payload());
            lease.holdUntil(call.inFlight());
            WriteOutcome outcome = call.toOutcome(operationId, StoreRole.SECONDARY, attempt);
            ledger.append(operationId, outcome);

            // 3. 결과 처리
            if (!outcome.isFailed()) {
                taskStore.remove(operationId);
                metrics.recordRetryResolved();
                log.info("Retry resolved: {} {} {} on attempt {}", kind, task.ref(), operationId, attempt);
                return;
            }
            if (attempt >= policy.maxAttempts()) {
                abandon(task, attempt, outcome.error());
                return;
            }
            long delay = backoffCalculator.calculate(attempt);
            taskStore.save(task.rescheduled(clock.millis() + delay, outcome.error()));
            log.warn("Retry attempt {}/{} failed for {} {}, next in {}ms: [{}] {}",
                attempt, policy.maxAttempts(), task.ref(), operationId, delay, outcome.errorCode(), outcome.error());
        }
    }

    private RetryTask abandon(RetryTask task, int attempts, String lastError) {
        OperationId operationId = task.operationId();
        RetryTask abandoned = task.terminated(RetryTaskState.ABANDONED, attempts, lastError);
        taskStore.remove(operationId);

        ensureLedgerEntry(task);
        ledger.append(operationId, WriteOutcome.failed(operationId, StoreRole.SECONDARY,
            WriteErrorCode.RETRIES_EXHAUSTED,
            "Retries exhausted after " + attempts + " attempt(s): " + lastError,
            clock.millis(), 0, Math.max(attempts, 1)));

        synchronized (abandonedHistory) {
            if (config.abandonedHistorySize() > 0) {
                if (abandonedHistory.size() >= config.abandonedHistorySize()) {
                    abandonedHistory.removeFirst();
                }
                abandonedHistory.addLast(abandoned);
            }
        }
        metrics.recordRetryAbandoned();
        log.error("Retry task abandoned: {} {} {} after {} attempt(s), last error: {}",
            task.kind(), task.ref(), operationId, attempts, lastError);
        return abandoned;
    }

    private void ensureLedgerEntry(RetryTask task) {
        if (ledger.find(task.operationId()).isEmpty()) {
            ledger.open(task.toOperation());
        }
    }

    public RetryQueueConfig getConfig() {
        return config;
    }
}
