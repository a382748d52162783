package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.adapter.inmemory.retry.InMemoryRetryTaskStore;
import com.ryuqq.dualwrite.application.retry.RetryQueue;
import com.ryuqq.dualwrite.core.config.DualWriteConfig;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.OverallStatus;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteErrorCode;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;
import com.ryuqq.dualwrite.core.spi.LedgerEntry;
import com.ryuqq.dualwrite.core.spi.RetryTaskStore;
import com.ryuqq.dualwrite.core.spi.WriteLedger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.dualwrite.testkit.OperationFixtures.create;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.delete;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.payload;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.ref;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.update;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

/**
 * SerializedDualWriteCoordinator 테스트.
 *
 * <p>In-memory 저장소와 장애 주입 어댑터로 전체 쓰기 흐름을 검증합니다:</p>
 * <ul>
 *   <li>정상: 두 저장소 모두 반영</li>
 *   <li>legacy 실패: PARTIAL_SUCCESS 후 재시도로 수렴</li>
 *   <li>primary 실패: secondary는 시도하지 않음</li>
 *   <li>멱등성, 모드별 동작</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class SerializedDualWriteCoordinatorTest {

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
    // 1. 정상 경로
    // ============================================================

    @Test
    void 두_저장소_정상_시_SUCCESS_및_양쪽_반영() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        Operation op = create("cart", "u123", "items", List.of("A-1"), "total", 19.99);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.SUCCESS);
        assertThat(result.secondaryDeferred()).isFalse();
        assertThat(result.secondaryOutcome()).isPresent();
        assertThat(engine.primaryData.get(op.ref())).contains(op.payload());
        assertThat(engine.secondaryData.get(op.ref())).contains(op.payload());
        assertThat(engine.retryQueue.depth()).isZero();
        assertThat(engine.metrics.operationCount(OverallStatus.SUCCESS)).isEqualTo(1);

        LedgerEntry entry = entryOf(op);
        assertThat(entry.isCompleted()).isTrue();
        assertThat(entry.outcomes()).extracting(WriteOutcome::store)
            .containsExactly(StoreRole.PRIMARY, StoreRole.SECONDARY);
    }

    @Test
    void 비동기_legacy_모드는_secondary를_지연하고_pump로_반영() {
        // given
        engine = DualWriteEngineFixture.create(new DualWriteConfig());
        Operation op = create("cart", "u123", "items", List.of("A-1"), "total", 19.99);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.SUCCESS);
        assertThat(result.secondaryDeferred()).isTrue();
        assertThat(result.secondaryOutcome()).isEmpty();
        assertThat(engine.secondaryData.get(op.ref())).isEmpty();
        assertThat(engine.retryQueue.depth()).isEqualTo(1);

        // when
        engine.retryQueue.pump();

        // then
        assertThat(engine.secondaryData.get(op.ref())).contains(op.payload());
        assertThat(engine.retryQueue.depth()).isZero();
        WriteOutcome secondary = entryOf(op).latestSecondary().orElseThrow();
        assertThat(secondary.isSuccess()).isTrue();
        assertThat(secondary.attempt()).isEqualTo(1);
        assertThat(engine.secondaryData.mutationsOf(op.ref()).get(0).kind()).isEqualTo(OperationKind.CREATE);
    }

    // ============================================================
    // 2. legacy 실패 → 재시도
    // ============================================================

    @Test
    void legacy_실패_시_PARTIAL_SUCCESS_후_재시도로_수렴() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        engine.secondary.failNextWrites(1);
        Operation op = create("cart", "u123", "items", List.of("A-1"), "total", 19.99);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.PARTIAL_SUCCESS);
        assertThat(result.failedStore()).contains(StoreRole.SECONDARY);
        assertThat(result.secondary().errorCode()).isEqualTo(WriteErrorCode.STORE_ERROR);
        assertThat(result.secondary().error()).contains("Connection refused");
        assertThat(engine.primaryData.get(op.ref())).contains(op.payload());
        assertThat(engine.retryQueue.depth()).isEqualTo(1);
        assertThat(engine.retryQueue.pending().get(0).attemptCount()).isEqualTo(1);

        // when: backoff 이전에는 시도하지 않음
        engine.retryQueue.pump();

        // then
        assertThat(engine.secondaryData.get(op.ref())).isEmpty();

        // when
        engine.clock.advance(1000);
        engine.retryQueue.pump();

        // then
        assertThat(engine.secondaryData.get(op.ref())).contains(op.payload());
        assertThat(engine.retryQueue.depth()).isZero();
        assertThat(engine.metrics.resolvedRetryCount()).isEqualTo(1);
        assertThat(engine.secondaryData.mutationsOf(op.ref()).get(0).kind())
            .as("A retried CREATE is replayed as an upsert")
            .isEqualTo(OperationKind.UPDATE);
        assertThat(entryOf(op).outcomesFor(StoreRole.SECONDARY))
            .extracting(WriteOutcome::attempt)
            .containsExactly(1, 2);
    }

    @Test
    void failOnLegacyError_설정_시_FAILED지만_재시도는_등록() {
        // given
        engine = DualWriteEngineFixture.create(new DualWriteConfig().withAsyncLegacy(false).withFailOnLegacyError(true));
        engine.secondary.failNextWrites(1);
        Operation op = update("cart", "u123", "items", List.of(), "total", 0);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.FAILED);
        assertThat(result.failedStore()).contains(StoreRole.SECONDARY);
        assertThat(engine.primaryData.get(op.ref())).contains(op.payload());
        assertThat(engine.retryQueue.depth()).isEqualTo(1);
        assertThat(engine.metrics.operationCount(OverallStatus.FAILED)).isEqualTo(1);
    }

    @Test
    void legacy_타임아웃은_TIMEOUT_실패로_기록() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        engine.secondary.delayWrites(DualWriteEngineFixture.STORE_TIMEOUT_MS * 4);
        Operation op = update("cart", "u123", "items", List.of("A-1"), "total", 1);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.PARTIAL_SUCCESS);
        assertThat(result.secondary().errorCode()).isEqualTo(WriteErrorCode.TIMEOUT);
        assertThat(engine.retryQueue.depth()).isEqualTo(1);
    }

    @Test
    void 대기_중인_재시도가_있으면_후속_쓰기도_큐_뒤로_지연() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        EntityRef cart = ref("cart", "u123");
        engine.secondary.failNextWrites(1);
        Operation first = update("cart", "u123", "items", List.of("A-1"), "total", 10);
        Operation second = update("cart", "u123", "items", List.of("A-1", "B-2"), "total", 25);
        engine.coordinator.execute(first);

        // when
        DualWriteResult result = engine.coordinator.execute(second);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.SUCCESS);
        assertThat(result.secondaryDeferred()).isTrue();
        assertThat(engine.secondary.writeAttempts()).isEqualTo(1);
        assertThat(engine.retryQueue.depth()).isEqualTo(2);

        // when: 키당 head만 시도하므로 두 번의 pump로 순서대로 반영
        engine.clock.advance(1000);
        engine.retryQueue.pump();

        // then
        assertThat(engine.secondaryData.get(cart)).contains(first.payload());

        // when
        engine.retryQueue.pump();

        // then
        assertThat(engine.secondaryData.get(cart)).contains(second.payload());
        assertThat(engine.retryQueue.depth()).isZero();
    }

    // ============================================================
    // 3. primary 실패
    // ============================================================

    @Test
    void primary_실패_시_FAILED_및_secondary_미시도() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        engine.primary.failNextWrites(1);
        Operation op = create("cart", "u123", "items", List.of("A-1"), "total", 19.99);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.FAILED);
        assertThat(result.failedStore()).contains(StoreRole.PRIMARY);
        assertThat(result.secondaryOutcome()).isEmpty();
        assertThat(engine.secondary.writeAttempts()).isZero();
        assertThat(engine.retryQueue.depth()).isZero();
        assertThat(entryOf(op).outcomes()).hasSize(1);
    }

    @Test
    void 이미_존재하는_키에_CREATE하면_DUPLICATE_KEY로_실패() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        EntityRef cart = ref("cart", "u123");
        engine.primaryData.seed(cart, payload("items", List.of("OLD"), "total", 1));
        Operation op = create("cart", "u123", "items", List.of("A-1"), "total", 19.99);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.FAILED);
        assertThat(result.primary().errorCode()).isEqualTo(WriteErrorCode.DUPLICATE_KEY);
        assertThat(engine.primaryData.get(cart).orElseThrow().get("total")).isEqualTo(1);
        assertThat(engine.secondary.writeAttempts()).isZero();
    }

    // ============================================================
    // 4. 멱등성 및 삭제
    // ============================================================

    @Test
    void 같은_작업을_다시_제출하면_캐시된_결과를_반환() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        Operation op = update("cart", "u123", "items", List.of("A-1"), "total", 19.99);
        DualWriteResult first = engine.coordinator.execute(op);

        // when
        DualWriteResult second = engine.coordinator.execute(op);

        // then
        assertThat(second).isEqualTo(first);
        assertThat(engine.primary.writeAttempts()).isEqualTo(1);
        assertThat(engine.secondary.writeAttempts()).isEqualTo(1);
        assertThat(engine.metrics.operationCount(OverallStatus.SUCCESS)).isEqualTo(1);
    }

    @Test
    void 실행_중인_작업이_원장에_열려_있으면_예외() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        Operation op = update("cart", "u123", "items", List.of("A-1"), "total", 1);
        engine.ledger.open(op);

        // when & then
        assertThatThrownBy(() -> engine.coordinator.execute(op))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already being executed");
    }

    @Test
    void 없는_키_삭제는_noOp_SUCCESS() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        Operation op = delete("cart", "missing");

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.SUCCESS);
        assertThat(result.primary().noOp()).isTrue();
        assertThat(result.secondary().noOp()).isTrue();
    }

    @Test
    void 삭제는_양쪽_저장소에서_제거() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        engine.coordinator.execute(create("cart", "u123", "items", List.of("A-1"), "total", 1));

        // when
        DualWriteResult result = engine.coordinator.execute(delete("cart", "u123"));

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(engine.primaryData.get(ref("cart", "u123"))).isEmpty();
        assertThat(engine.secondaryData.get(ref("cart", "u123"))).isEmpty();
    }

    // ============================================================
    // 5. 모드
    // ============================================================

    @Test
    void 신규_저장소_전용_모드는_secondary를_쓰지_않음() {
        // given
        engine = DualWriteEngineFixture.create(DualWriteConfig.newStoreOnly());
        Operation op = update("cart", "u123", "items", List.of("A-1"), "total", 1);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.SUCCESS);
        assertThat(result.secondaryOutcome()).isEmpty();
        assertThat(result.secondaryDeferred()).isFalse();
        assertThat(engine.secondary.writeAttempts()).isZero();
        assertThat(engine.retryQueue.depth()).isZero();
    }

    @Test
    void legacy_전용_모드는_primary를_건너뛰고_legacy에_동기_기록() {
        // given
        engine = DualWriteEngineFixture.create(DualWriteConfig.legacyStoreOnly());
        Operation op = update("cart", "u123", "items", List.of("A-1"), "total", 1);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.SUCCESS);
        assertThat(result.primary().isSkipped()).isTrue();
        assertThat(engine.primary.writeAttempts()).isZero();
        assertThat(engine.secondaryData.get(op.ref())).contains(op.payload());
    }

    @Test
    void legacy_전용_모드에서_legacy_실패는_재시도_없이_FAILED() {
        // given
        engine = DualWriteEngineFixture.create(DualWriteConfig.legacyStoreOnly());
        engine.secondary.failNextWrites(1);

        // when
        DualWriteResult result = engine.coordinator.execute(update("cart", "u123", "items", List.of(), "total", 0));

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.FAILED);
        assertThat(result.failedStore()).contains(StoreRole.SECONDARY);
        assertThat(engine.retryQueue.depth()).isZero();
    }

    // ============================================================
    // 6. 타임아웃 후에도 실행 중인 쓰기
    // ============================================================

    @Test
    void 인터럽트를_무시하는_primary_쓰기가_끝날_때까지_같은_키의_다음_쓰기는_대기() throws Exception {
        // given
        engine = DualWriteEngineFixture.create(DualWriteConfig.newStoreOnly());
        CountDownLatch gate = new CountDownLatch(1);
        engine.primary.stallNextWrite(gate);
        Operation first = update("cart", "u123", "items", List.of("A-1"), "total", 1);
        Operation second = update("cart", "u123", "items", List.of("A-1"), "total", 2);

        // when
        DualWriteResult firstResult = engine.coordinator.execute(first);
        CompletableFuture<DualWriteResult> secondResult =
            CompletableFuture.supplyAsync(() -> engine.coordinator.execute(second));
        Thread.sleep(DualWriteEngineFixture.STORE_TIMEOUT_MS);
        boolean secondFinishedWhileFirstRunning = secondResult.isDone();
        gate.countDown();

        // then
        assertThat(firstResult.overall()).isEqualTo(OverallStatus.FAILED);
        assertThat(firstResult.primary().errorCode()).isEqualTo(WriteErrorCode.TIMEOUT);
        assertThat(secondFinishedWhileFirstRunning).isFalse();
        assertThat(secondResult.get(5, TimeUnit.SECONDS).overall()).isEqualTo(OverallStatus.SUCCESS);
        assertThat(engine.primaryData.get(ref("cart", "u123")).orElseThrow().get("total")).isEqualTo(2);
        assertThat(engine.primaryData.mutationsOf(ref("cart", "u123")))
            .extracting(mutation -> mutation.payload().get("total"))
            .containsExactly(1, 2);
    }

    @Test
    void 인터럽트를_무시하는_legacy_쓰기가_끝나기_전에는_재시도하지_않음() throws Exception {
        // given
        engine = DualWriteEngineFixture.synchronous();
        CountDownLatch gate = new CountDownLatch(1);
        engine.secondary.stallNextWrite(gate);
        Operation op = update("cart", "u123", "items", List.of("A-1"), "total", 7);
        DualWriteResult result = engine.coordinator.execute(op);
        engine.clock.advance(1000);

        // when
        CompletableFuture<Void> retry = CompletableFuture.runAsync(engine.retryQueue::pump);
        Thread.sleep(DualWriteEngineFixture.STORE_TIMEOUT_MS);
        boolean retriedWhileFirstRunning = retry.isDone();
        gate.countDown();
        retry.get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.PARTIAL_SUCCESS);
        assertThat(result.secondary().errorCode()).isEqualTo(WriteErrorCode.TIMEOUT);
        assertThat(retriedWhileFirstRunning).isFalse();
        assertThat(engine.secondaryData.mutationsOf(ref("cart", "u123"))).hasSize(2);
        assertThat(engine.retryQueue.depth()).isZero();
    }

    // ============================================================
    // 7. 재시도 등록 실패
    // ============================================================

    @Test
    void 재시도_등록이_실패해도_결과를_반환하고_원장을_완료() {
        // given
        RetryTaskStore failingStore = spy(new InMemoryRetryTaskStore());
        doThrow(new UncheckedIOException("disk full", new IOException("disk full")))
            .when(failingStore).save(any());
        engine = DualWriteEngineFixture.create(new DualWriteConfig().withAsyncLegacy(false), failingStore);
        engine.secondary.failAllWrites();
        Operation op = update("cart", "u123", "items", List.of("A-1"), "total", 3);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.PARTIAL_SUCCESS);
        assertThat(result.secondary().error()).contains("retry task could not be recorded");
        assertThat(engine.primaryData.get(ref("cart", "u123"))).isPresent();
        assertThat(entryOf(op).isCompleted()).isTrue();
        assertThat(engine.retryQueue.depth()).isZero();
    }

    @Test
    void 재시도_등록_실패_후_재제출은_캐시된_결과를_반환() {
        // given
        RetryTaskStore failingStore = spy(new InMemoryRetryTaskStore());
        doThrow(new UncheckedIOException("disk full", new IOException("disk full")))
            .when(failingStore).save(any());
        engine = DualWriteEngineFixture.create(new DualWriteConfig().withAsyncLegacy(false), failingStore);
        engine.secondary.failAllWrites();
        Operation op = update("cart", "u123", "items", List.of("A-1"), "total", 3);
        DualWriteResult first = engine.coordinator.execute(op);

        // when
        DualWriteResult again = engine.coordinator.execute(op);

        // then
        assertThat(again).isEqualTo(first);
        assertThat(engine.primary.writeAttempts()).isEqualTo(1);
    }

    @Test
    void 비동기_모드에서_재시도_등록이_실패하면_secondary_실패로_기록() {
        // given
        RetryTaskStore failingStore = spy(new InMemoryRetryTaskStore());
        doThrow(new UncheckedIOException("disk full", new IOException("disk full")))
            .when(failingStore).save(any());
        engine = DualWriteEngineFixture.create(new DualWriteConfig(), failingStore);
        Operation op = create("cart", "u123", "items", List.of(), "total", 0);

        // when
        DualWriteResult result = engine.coordinator.execute(op);

        // then
        assertThat(result.overall()).isEqualTo(OverallStatus.PARTIAL_SUCCESS);
        assertThat(result.secondaryDeferred()).isFalse();
        assertThat(result.secondary().errorCode()).isEqualTo(WriteErrorCode.STORE_ERROR);
        assertThat(result.secondary().error()).contains("not dispatched");
        assertThat(engine.secondary.writeAttempts()).isZero();
        assertThat(entryOf(op).outcomes()).extracting(WriteOutcome::store)
            .containsExactly(StoreRole.PRIMARY, StoreRole.SECONDARY);
    }

    @Test
    void 예기치_못한_예외로_중단되면_원장을_FAILED로_완료하고_예외_전파() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        RetryQueue brokenQueue = mock(RetryQueue.class);
        when(brokenQueue.hasPending(any())).thenThrow(new IllegalStateException("queue unavailable"));
        SerializedDualWriteCoordinator coordinator = new SerializedDualWriteCoordinator(engine.config,
            engine.primary, engine.secondary, engine.ledger, brokenQueue, engine.leaseManager,
            engine.storeInvoker, engine.metrics);
        Operation op = update("cart", "u123", "items", List.of(), "total", 0);

        // when & then
        assertThatThrownBy(() -> coordinator.execute(op))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("queue unavailable");
        LedgerEntry entry = entryOf(op);
        assertThat(entry.isCompleted()).isTrue();
        assertThat(entry.completedResult().orElseThrow().overall()).isEqualTo(OverallStatus.FAILED);
        assertThat(coordinator.execute(op).overall()).isEqualTo(OverallStatus.FAILED);
    }

    // ============================================================
    // 8. 생성자 검증
    // ============================================================

    @Test
    void 원장_open이_실패하면_예외() {
        // given
        engine = DualWriteEngineFixture.synchronous();
        WriteLedger ledger = mock(WriteLedger.class);
        when(ledger.find(any())).thenReturn(Optional.empty());
        when(ledger.open(any())).thenReturn(false);
        SerializedDualWriteCoordinator coordinator = new SerializedDualWriteCoordinator(engine.config,
            engine.primary, engine.secondary, ledger, engine.retryQueue, engine.leaseManager,
            engine.storeInvoker, engine.metrics);

        // when & then
        assertThatThrownBy(() -> coordinator.execute(update("cart", "u1", "items", List.of(), "total", 0)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(engine.primary.writeAttempts()).isZero();
    }

    @Test
    void null_의존성은_거부() {
        engine = DualWriteEngineFixture.synchronous();

        assertThatThrownBy(() -> new SerializedDualWriteCoordinator(null, engine.primary, engine.secondary,
            engine.ledger, engine.retryQueue, engine.leaseManager, engine.storeInvoker, engine.metrics))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }
}
