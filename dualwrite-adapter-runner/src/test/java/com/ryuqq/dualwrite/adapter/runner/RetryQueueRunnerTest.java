package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.core.config.DualWriteConfig;
import com.ryuqq.dualwrite.core.config.RetryPolicy;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteErrorCode;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;
import com.ryuqq.dualwrite.core.retry.RetryTask;
import com.ryuqq.dualwrite.core.retry.RetryTaskState;
import com.ryuqq.dualwrite.core.spi.LedgerEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.dualwrite.testkit.OperationFixtures.update;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryQueueRunner 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>Backoff 스케줄과 maxAttempts 소진 시 포기 처리</li>
 *   <li>키별 순서 (head 태스크만 시도)</li>
 *   <li>취소, 배치 크기, 복구된 태스크 처리</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class RetryQueueRunnerTest {

    private DualWriteEngineFixture engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private LedgerEntry entryOf(Operation operation) {
        return engine.ledger.find(operation.operationId()).orElseThrow();
    }

    // ============================================================
    // 1. enqueue
    // ============================================================

    @Test
    void enqueue_시도_없음은_즉시_실행_가능() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        Operation op = update("cart", "u1", "items", List.of(), "total", 0);

        // when
        RetryTask task = engine.retryQueue.enqueue(op, 0, null);

        // then
        assertThat(task.nextAttemptAt()).isEqualTo(DualWriteEngineFixture.START_MILLIS);
        assertThat(task.attemptCount()).isZero();
        assertThat(engine.retryQueue.hasPending(op.ref())).isTrue();
    }

    @Test
    void enqueue_실패_횟수에_따라_backoff_적용() {
        // given
        engine = DualWriteEngineFixture.synchronous();

        // when
        RetryTask once = engine.retryQueue.enqueue(update("cart", "u1", "total", 1), 1, "down");
        RetryTask twice = engine.retryQueue.enqueue(update("cart", "u2", "total", 1), 2, "down");

        // then
        assertThat(once.nextAttemptAt()).isEqualTo(DualWriteEngineFixture.START_MILLIS + 1000);
        assertThat(twice.nextAttemptAt()).isEqualTo(DualWriteEngineFixture.START_MILLIS + 2000);
        assertThat(twice.sequence()).isGreaterThan(once.sequence());
    }

    @Test
    void enqueue_이미_maxAttempts를_소진했으면_즉시_포기() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        Operation op = update("cart", "u1", "total", 1);
        engine.ledger.open(op);

        // when
        RetryTask task = engine.retryQueue.enqueue(op, 3, "down");

        // then
        assertThat(task.state()).isEqualTo(RetryTaskState.ABANDONED);
        assertThat(engine.retryQueue.depth()).isZero();
        assertThat(engine.retryQueue.abandoned()).hasSize(1);
        assertThat(engine.metrics.abandonedRetryCount()).isEqualTo(1);
    }

    @Test
    void enqueue_종료된_태스크는_거부() {
        engine = DualWriteEngineFixture.synchronous();
        RetryTask resolved = RetryTask.pending(update("cart", "u1", "total", 1), 1, 1, 0, 0, null)
            .terminated(RetryTaskState.RESOLVED, 2, null);

        assertThatThrownBy(() -> engine.retryQueue.enqueue(resolved))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Only PENDING tasks");
    }

    // ============================================================
    // 2. 소진 및 포기
    // ============================================================

    @Test
    void maxAttempts_소진_시_포기하고_RETRIES_EXHAUSTED_기록() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        engine.secondary.failAllWrites();
        Operation op = update("cart", "u1", "items", List.of("A-1"), "total", 5);
        engine.coordinator.execute(op);

        // when: 시도 2 (1000ms 후), 시도 3 (2000ms 후)
        engine.clock.advance(1000);
        engine.retryQueue.pump();
        assertThat(engine.retryQueue.pending().get(0).attemptCount()).isEqualTo(2);
        engine.clock.advance(2000);
        engine.retryQueue.pump();

        // then
        assertThat(engine.retryQueue.depth()).isZero();
        assertThat(engine.retryQueue.oldestPendingAgeMillis()).isEmpty();
        assertThat(engine.metrics.abandonedRetryCount()).isEqualTo(1);
        assertThat(engine.secondary.writeAttempts()).isEqualTo(3);

        List<RetryTask> abandoned = engine.retryQueue.abandoned();
        assertThat(abandoned).hasSize(1);
        assertThat(abandoned.get(0).attemptCount()).isEqualTo(3);
        assertThat(abandoned.get(0).state()).isEqualTo(RetryTaskState.ABANDONED);

        WriteOutcome last = entryOf(op).latestSecondary().orElseThrow();
        assertThat(last.errorCode()).isEqualTo(WriteErrorCode.RETRIES_EXHAUSTED);
        assertThat(last.error()).contains("Retries exhausted after 3 attempt(s)");
    }

    @Test
    void 포기_이력은_설정된_크기로_제한() {
        // given
        engine = DualWriteEngineFixture.create(
            new DualWriteConfig().withRetry(new RetryPolicy(1, 1000, 1000, 0.0)),
            new RetryQueueConfig().withAbandonedHistorySize(2));

        // when
        for (int i = 0; i < 3; i++) {
            engine.retryQueue.enqueue(update("cart", "u" + i, "total", i), 1, "down");
        }

        // then
        assertThat(engine.retryQueue.abandoned())
            .extracting(task -> task.ref().entityKey().getValue())
            .containsExactly("u1", "u2");
        assertThat(engine.metrics.abandonedRetryCount()).isEqualTo(3);
    }

    // ============================================================
    // 3. 순서 및 배치
    // ============================================================

    @Test
    void 같은_키는_head_태스크만_시도() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        Operation first = update("cart", "u1", "total", 1);
        Operation second = update("cart", "u1", "total", 2);
        engine.retryQueue.enqueue(first, 1, "down");
        engine.retryQueue.enqueue(second, 0, null);

        // when: head는 아직 due가 아니므로 뒤 태스크도 대기
        engine.retryQueue.pump();

        // then
        assertThat(engine.secondary.writeAttempts()).isZero();
        assertThat(engine.retryQueue.depth()).isEqualTo(2);
    }

    @Test
    void 배치_크기만큼만_시도() {
        // given
        engine = DualWriteEngineFixture.create(new DualWriteConfig(), new RetryQueueConfig().withBatchSize(2));
        for (int i = 0; i < 3; i++) {
            engine.retryQueue.enqueue(update("cart", "u" + i, "total", i), 0, null);
        }

        // when
        engine.retryQueue.pump();

        // then
        assertThat(engine.secondary.writeAttempts()).isEqualTo(2);
        assertThat(engine.retryQueue.depth()).isEqualTo(1);
        assertThat(engine.retryQueue.pending().get(0).ref().entityKey().getValue()).isEqualTo("u2");
    }

    @Test
    void 원장_항목이_없는_복구_태스크도_처리() {
        // given: 재시작 후 영속 큐에서 복원된 태스크 (원장은 비어 있음)
        engine = DualWriteEngineFixture.synchronous();
        Operation op = update("cart", "u1", "items", List.of("A-1"), "total", 3);
        engine.retryQueue.enqueue(RetryTask.pending(op, engine.taskStore.nextSequence(), 0,
            DualWriteEngineFixture.START_MILLIS, DualWriteEngineFixture.START_MILLIS, null));

        // when
        engine.retryQueue.pump();

        // then
        assertThat(engine.secondaryData.get(op.ref())).contains(op.payload());
        LedgerEntry entry = entryOf(op);
        assertThat(entry.outcomesFor(StoreRole.SECONDARY)).hasSize(1);
        assertThat(entry.isCompleted()).isFalse();
    }

    @Test
    void 가장_오래된_대기_태스크의_나이() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        engine.retryQueue.enqueue(update("cart", "u1", "total", 1), 1, "down");
        engine.clock.advance(500);
        engine.retryQueue.enqueue(update("cart", "u2", "total", 1), 1, "down");

        // when
        engine.clock.advance(250);

        // then
        assertThat(engine.retryQueue.oldestPendingAgeMillis()).hasValue(750);
    }

    // ============================================================
    // 4. 취소
    // ============================================================

    @Test
    void cancel_태스크를_제거하고_CANCELLED_기록() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        engine.secondary.failNextWrites(1);
        Operation op = update("cart", "u1", "total", 1);
        engine.coordinator.execute(op);

        // when
        boolean cancelled = engine.retryQueue.cancel(op.operationId());

        // then
        assertThat(cancelled).isTrue();
        assertThat(engine.retryQueue.depth()).isZero();
        WriteOutcome last = entryOf(op).latestSecondary().orElseThrow();
        assertThat(last.isSkipped()).isTrue();
        assertThat(last.errorCode()).isEqualTo(WriteErrorCode.CANCELLED);
        assertThat(engine.retryQueue.cancel(op.operationId())).isFalse();
    }

    @Test
    void cancelAll_엔티티_타입별_취소() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        engine.retryQueue.enqueue(update("cart", "u1", "total", 1), 1, "down");
        engine.retryQueue.enqueue(update("cart", "u2", "total", 1), 1, "down");
        engine.retryQueue.enqueue(update("product", "p1", "name", "Kettle"), 1, "down");

        // when
        int cancelled = engine.retryQueue.cancelAll(EntityType.of("cart"));

        // then
        assertThat(cancelled).isEqualTo(2);
        assertThat(engine.retryQueue.pending())
            .extracting(task -> task.ref().entityType().getValue())
            .containsExactly("product");
    }

    @Test
    void 생성자_null_검증() {
        engine = DualWriteEngineFixture.synchronous();

        assertThatThrownBy(() -> new RetryQueueRunner(null, engine.secondary, engine.ledger, engine.leaseManager,
            engine.storeInvoker, new RetryPolicy(), new RetryQueueConfig(), engine.metrics))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }
}
