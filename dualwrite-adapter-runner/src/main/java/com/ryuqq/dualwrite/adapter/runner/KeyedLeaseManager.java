package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.core.model.EntityRef;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 엔티티 키 단위 직렬화기 (Per-Key Serializer).
 *
 * <p>같은 (entityType, entityKey)를 대상으로 하는 작업은 한 번에 하나씩,
 * 제출 순서대로 실행되며, 서로 다른 키의 작업은 완전히 병렬로 진행됩니다.</p>
 *
 * <p><strong>구현:</strong></p>
 * <ul>
 *   <li>키마다 공정(fair) {@link ReentrantLock}: 대기자는 도착 순서(FIFO)로 lease를 받음</li>
 *   <li>참조 카운트: lease를 보유하거나 대기 중인 스레드 수. 0이 되면 맵에서 제거되어
 *       키 카디널리티가 높아도 메모리가 제한됨</li>
 *   <li>카운트 증감은 {@link ConcurrentHashMap#compute}로 키 단위 원자성 보장</li>
 *   <li>타임아웃 후에도 실행 중인 스토어 호출은 {@link Lease#holdUntil}로 키에 묶이며,
 *       다음 보유자는 lock을 얻은 뒤 그 호출이 끝날 때까지 대기</li>
 * </ul>
 *
 * <p><strong>교착 상태 없음:</strong> lease 하나가 자원 하나만 잡고, 중첩 획득이 없습니다.
 * 같은 스레드의 중첩 획득은 {@link IllegalStateException}으로 거부합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (Lease lease = leaseManager.acquire(ref)) {
 *     // ref에 대한 쓰기
 * }
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class KeyedLeaseManager {

    private static final Logger log = LoggerFactory.getLogger(KeyedLeaseManager.class);

    private final ConcurrentHashMap<EntityRef, KeyLock> locks = new ConcurrentHashMap<>();

    /**
     * lease 획득 (대기).
     *
     * @param ref 대상 엔티티
     * @return 보유 중인 lease
     * @throws IllegalArgumentException ref가 null인 경우
     * @throws IllegalStateException 현재 스레드가 이미 같은 키의 lease를 보유한 경우
     */
    public Lease acquire(EntityRef ref) {
        KeyLock keyLock = retain(ref);
        if (keyLock.lock.isHeldByCurrentThread()) {
            release(ref, keyLock);
            throw new IllegalStateException("Nested lease acquisition on " + ref);
        }
        keyLock.lock.lock();
        awaitInFlight(ref, keyLock);
        return new Lease(this, ref, keyLock);
    }

    /**
     * 제한 시간 내 lease 획득.
     *
     * @param ref 대상 엔티티
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 보유 중인 lease, 시간 초과 시 null
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public Lease tryAcquire(EntityRef ref, long timeout, TimeUnit unit) throws InterruptedException {
        KeyLock keyLock = retain(ref);
        if (keyLock.lock.isHeldByCurrentThread()) {
            release(ref, keyLock);
            throw new IllegalStateException("Nested lease acquisition on " + ref);
        }
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        boolean acquired = false;
        try {
            acquired = keyLock.lock.tryLock(timeout, unit);
            if (acquired) {
                boolean settled = false;
                try {
                    settled = awaitInFlight(ref, keyLock, deadline - System.nanoTime());
                } finally {
                    if (!settled) {
                        keyLock.lock.unlock();
                        acquired = false;
                    }
                }
            }
        } finally {
            if (!acquired) {
                release(ref, keyLock);
            }
        }
        return acquired ? new Lease(this, ref, keyLock) : null;
    }

    /**
     * lease 반환. 같은 lease를 두 번 반환해도 안전합니다.
     *
     * @param lease 반환할 lease
     */
    public void release(Lease lease) {
        if (lease == null) {
            throw new IllegalArgumentException("lease cannot be null");
        }
        lease.close();
    }

    /**
     * 현재 추적 중인 키 수 (보유 또는 대기 중).
     *
     * @return 키 수
     */
    public int activeKeys() {
        return locks.size();
    }

    private static void awaitInFlight(EntityRef ref, KeyLock keyLock) {
        CompletableFuture<?> inFlight = keyLock.inFlight;
        if (inFlight == null) {
            return;
        }
        if (!inFlight.isDone()) {
            log.debug("Waiting for a timed-out store call on {} to finish", ref);
        }
        inFlight.join();
        keyLock.inFlight = null;
    }

    private static boolean awaitInFlight(EntityRef ref, KeyLock keyLock, long remainingNanos)
        throws InterruptedException {
        CompletableFuture<?> inFlight = keyLock.inFlight;
        if (inFlight == null) {
            return true;
        }
        try {
            inFlight.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.debug("Timed-out store call on {} still running, lease not granted", ref);
            return false;
        } catch (ExecutionException e) {
            // 종료 신호일 뿐이므로 실패 여부와 관계없이 끝난 것으로 봄
            log.debug("Timed-out store call on {} finished exceptionally", ref, e);
        }
        keyLock.inFlight = null;
        return true;
    }

    private KeyLock retain(EntityRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        return locks.compute(ref, (key, existing) -> {
            KeyLock keyLock = existing == null ? new KeyLock() : existing;
            keyLock.references++;
            return keyLock;
        });
    }

    private void release(EntityRef ref, KeyLock keyLock) {
        locks.computeIfPresent(ref, (key, existing) -> {
            if (existing != keyLock) {
                return existing;
            }
            existing.references--;
            return existing.references == 0 ? null : existing;
        });
    }

    private static final class KeyLock {

        private final ReentrantLock lock = new ReentrantLock(true);

        // compute() 안에서만 변경
        private int references;

        // lock 보유 중에만 접근
        private CompletableFuture<?> inFlight;
    }

    /**
     * 하나의 키에 대한 배타적 실행 권한.
     */
    public static final class Lease implements AutoCloseable {

        private final KeyedLeaseManager owner;
        private final EntityRef ref;
        private final KeyLock keyLock;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(KeyedLeaseManager owner, EntityRef ref, KeyLock keyLock) {
            this.owner = owner;
            this.ref = ref;
            this.keyLock = keyLock;
        }

        public EntityRef getRef() {
            return ref;
        }

        public boolean isReleased() {
            return released.get();
        }

        /**
         * 타임아웃 후에도 실행 중인 스토어 호출을 이 키에 묶습니다.
         *
         * <p>lease를 반환해도 다음 보유자는 호출이 끝날 때까지 대기하므로,
         * 늦게 반영된 쓰기가 이후 쓰기를 덮어쓰지 않습니다. 호출이 끝날 때까지
         * 키 항목도 맵에 유지됩니다.</p>
         *
         * @param inFlight 호출 종료 신호 (null이거나 이미 끝났으면 무시)
         * @throws IllegalStateException 이미 반환된 lease인 경우
         */
        public void holdUntil(CompletableFuture<?> inFlight) {
            if (inFlight == null || inFlight.isDone()) {
                return;
            }
            if (released.get()) {
                throw new IllegalStateException("Lease on " + ref + " is already released");
            }
            CompletableFuture<?> previous = keyLock.inFlight;
            keyLock.inFlight = previous == null || previous.isDone()
                ? inFlight
                : CompletableFuture.allOf(previous, inFlight);
            owner.retain(ref);
            inFlight.whenComplete((ignored, error) -> owner.release(ref, keyLock));
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                keyLock.lock.unlock();
                owner.release(ref, keyLock);
            }
        }
    }
}
