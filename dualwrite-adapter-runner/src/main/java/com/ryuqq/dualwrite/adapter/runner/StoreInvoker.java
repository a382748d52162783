package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.core.model.EntityKey;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.outcome.StoreResult;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteErrorCode;
import com.ryuqq.dualwrite.core.spi.KeyPage;
import com.ryuqq.dualwrite.core.spi.StoreAdapter;
import com.ryuqq.dualwrite.core.validation.StoreReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출별 타임아웃을 적용한 스토어 어댑터 호출기.
 *
 * <p>모든 스토어 호출은 전용 스레드 풀에서 실행되며, 설정된 시간 안에 끝나지 않으면
 * 취소(인터럽트)되고 실패로 처리됩니다. 무기한 대기는 발생하지 않습니다.</p>
 *
 * <p><strong>실패 변환 (쓰기):</strong></p>
 * <ul>
 *   <li>타임아웃 → Rejected(TIMEOUT)</li>
 *   <li>어댑터 예외 → Rejected(STORE_ERROR)</li>
 *   <li>어댑터가 null 반환 → Rejected(STORE_ERROR)</li>
 * </ul>
 *
 * <p><strong>타임아웃 후 계속 실행되는 쓰기:</strong> 인터럽트를 무시하는 어댑터는 타임아웃 이후에도
 * 쓰기를 반영할 수 있습니다. 이 경우 {@link StoreCall#inFlight()}로 종료 신호를 돌려주며,
 * 호출자는 이를 {@link KeyedLeaseManager.Lease#holdUntil}에 넘겨 같은 키의 다음 쓰기를 뒤로 미룹니다.</p>
 *
 * <p><strong>실패 변환 (읽기/스캔):</strong> 비교 결과를 만들 수 없으므로
 * {@link StoreReadException}을 던집니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class StoreInvoker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StoreInvoker.class);

    private final long timeoutMs;
    private final Clock clock;
    private final ExecutorService callExecutor;

    /**
     * @param timeoutMs 호출별 타임아웃 (밀리초, 양수)
     */
    public StoreInvoker(long timeoutMs) {
        this(timeoutMs, Clock.systemUTC());
    }

    /**
     * @param timeoutMs 호출별 타임아웃 (밀리초, 양수)
     * @param clock 시각 측정용 시계
     */
    public StoreInvoker(long timeoutMs, Clock clock) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.timeoutMs = timeoutMs;
        this.clock = clock;
        AtomicInteger threadNumber = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "dualwrite-store-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 작업 종류에 맞는 쓰기 호출.
     *
     * @param adapter 대상 어댑터
     * @param store 대상 스토어 역할 (로그용)
     * @param ref 대상 엔티티
     * @param kind 작업 종류
     * @param payload 엔티티 데이터
     * @return 시간 측정이 포함된 결과 (예외를 던지지 않음)
     */
    public StoreCall write(StoreAdapter adapter, StoreRole store, EntityRef ref, OperationKind kind, Payload payload) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        long startedAt = clock.millis();
        long startNanos = System.nanoTime();
        TrackedWrite tracked = new TrackedWrite(
            () -> kind == OperationKind.DELETE ? adapter.delete(ref) : adapter.put(ref, kind, payload));
        StoreResult result = callWrite(adapter, store, ref, kind, tracked);
        long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        log.debug("{} {} {} on {} -> {} ({}ms)", store, kind, ref, adapter.name(), result, durationMillis);

        CompletableFuture<Void> inFlight = tracked.settled.isDone() ? null : tracked.settled;
        if (inFlight != null) {
            log.warn("{} {} {} on {} is still running after timeout, next write on the key waits for it",
                store, kind, ref, adapter.name());
        }
        return new StoreCall(result, startedAt, durationMillis, inFlight);
    }

    /**
     * 엔티티 읽기.
     *
     * @throws StoreReadException 실패 또는 타임아웃
     */
    public Optional<Payload> read(StoreAdapter adapter, StoreRole store, EntityRef ref) {
        Optional<Payload> payload = callRead(adapter, store, ref.toString(), () -> adapter.get(ref));
        return payload == null ? Optional.empty() : payload;
    }

    /**
     * 키 페이지 스캔.
     *
     * @throws StoreReadException 실패 또는 타임아웃
     */
    public KeyPage scan(StoreAdapter adapter, StoreRole store, EntityType entityType, EntityKey after, int limit) {
        KeyPage page = callRead(adapter, store, entityType.getValue() + " keys after " + after,
            () -> adapter.scanKeys(entityType, after, limit));
        return page == null ? KeyPage.empty() : page;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public Clock getClock() {
        return clock;
    }

    private StoreResult callWrite(StoreAdapter adapter, StoreRole store, EntityRef ref, OperationKind kind,
                                  TrackedWrite call) {
        Future<StoreResult> future = callExecutor.submit(call);
        try {
            StoreResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return StoreResult.rejected(WriteErrorCode.STORE_ERROR, adapter.name() + " returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            call.abandon();
            future.cancel(true);
            log.warn("{} {} {} on {} timed out after {}ms", store, kind, ref, adapter.name(), timeoutMs);
            return StoreResult.rejected(WriteErrorCode.TIMEOUT,
                adapter.name() + " did not respond within " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("{} {} {} on {} failed: {}", store, kind, ref, adapter.name(), cause.toString());
            return StoreResult.rejected(WriteErrorCode.STORE_ERROR, describe(cause));
        } catch (InterruptedException e) {
            call.abandon();
            future.cancel(true);
            Thread.currentThread().interrupt();
            return StoreResult.rejected(WriteErrorCode.STORE_ERROR, "Interrupted while writing to " + adapter.name());
        }
    }

    private <T> T callRead(StoreAdapter adapter, StoreRole store, String target, Callable<T> call) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        Future<T> future = callExecutor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StoreReadException(store,
                "Reading " + target + " from " + adapter.name() + " timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof IllegalArgumentException illegal) {
                throw illegal;
            }
            throw new StoreReadException(store,
                "Reading " + target + " from " + adapter.name() + " failed: " + describe(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreReadException(store, "Interrupted while reading " + target + " from " + adapter.name(), e);
        }
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return (message == null || message.isBlank()) ? cause.getClass().getSimpleName() : message;
    }

    /**
     * 실제 어댑터 호출의 시작과 종료를 추적하는 쓰기 작업.
     *
     * <p>시작 전에 포기된 작업은 어댑터를 호출하지 않고 곧바로 종료 신호를 보냅니다.
     * 시작된 작업은 어댑터가 반환할 때 종료 신호를 보냅니다.</p>
     */
    private static final class TrackedWrite implements Callable<StoreResult> {

        private static final int NEW = 0;
        private static final int RUNNING = 1;
        private static final int ABANDONED = 2;

        private final Callable<StoreResult> call;
        private final AtomicInteger phase = new AtomicInteger(NEW);
        private final CompletableFuture<Void> settled = new CompletableFuture<>();

        private TrackedWrite(Callable<StoreResult> call) {
            this.call = call;
        }

        @Override
        public StoreResult call() throws Exception {
            if (!phase.compareAndSet(NEW, RUNNING)) {
                settled.complete(null);
                return StoreResult.rejected(WriteErrorCode.TIMEOUT, "Abandoned before start");
            }
            try {
                return call.call();
            } finally {
                settled.complete(null);
            }
        }

        private void abandon() {
            if (phase.compareAndSet(NEW, ABANDONED)) {
                settled.complete(null);
            }
        }
    }

    /**
     * 호출 스레드 풀 종료.
     */
    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
