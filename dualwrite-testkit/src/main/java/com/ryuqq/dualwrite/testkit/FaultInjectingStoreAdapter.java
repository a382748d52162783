package com.ryuqq.dualwrite.testkit;

import com.ryuqq.dualwrite.core.model.EntityKey;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.outcome.StoreResult;
import com.ryuqq.dualwrite.core.spi.KeyPage;
import com.ryuqq.dualwrite.core.spi.StoreAdapter;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * StoreAdapter decorator that simulates an unhealthy store.
 *
 * <p>Write faults are raised as exceptions, the way a broken driver or connection pool
 * surfaces them, so the engine's own exception-to-outcome conversion is exercised.</p>
 *
 * <p><strong>Fault Modes:</strong></p>
 * <ul>
 *   <li>{@link #failNextWrites(int)}: the next N writes throw</li>
 *   <li>{@link #failAllWrites()}: every write throws until {@link #recover()}</li>
 *   <li>{@link #failReads(boolean)}: reads and scans throw</li>
 *   <li>{@link #delayWrites(long)}: writes sleep before delegating (timeout simulation)</li>
 *   <li>{@link #stallNextWrite(CountDownLatch)}: the next write ignores interrupts and waits for
 *       the gate, then lands (a driver that does not honour cancellation)</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public class FaultInjectingStoreAdapter implements StoreAdapter {

    private final StoreAdapter delegate;
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicBoolean failAllWrites = new AtomicBoolean();
    private final AtomicBoolean failReads = new AtomicBoolean();
    private final AtomicLong writeDelayMillis = new AtomicLong();
    private final AtomicInteger writeAttempts = new AtomicInteger();
    private final AtomicReference<CountDownLatch> stallGate = new AtomicReference<>();

    public FaultInjectingStoreAdapter(StoreAdapter delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public StoreResult put(EntityRef ref, OperationKind kind, Payload payload) {
        beforeWrite();
        return delegate.put(ref, kind, payload);
    }

    @Override
    public StoreResult delete(EntityRef ref) {
        beforeWrite();
        return delegate.delete(ref);
    }

    @Override
    public Optional<Payload> get(EntityRef ref) {
        beforeRead();
        return delegate.get(ref);
    }

    @Override
    public KeyPage scanKeys(EntityType entityType, EntityKey afterExclusive, int limit) {
        beforeRead();
        return delegate.scanKeys(entityType, afterExclusive, limit);
    }

    private void beforeWrite() {
        writeAttempts.incrementAndGet();
        CountDownLatch gate = stallGate.getAndSet(null);
        if (gate != null) {
            awaitIgnoringInterrupts(gate);
        }
        long delay = writeDelayMillis.get();
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Write to " + name() + " interrupted", e);
            }
        }
        if (failAllWrites.get() || failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("Connection refused: " + name());
        }
    }

    private static void awaitIgnoringInterrupts(CountDownLatch gate) {
        boolean interrupted = false;
        while (true) {
            try {
                gate.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void beforeRead() {
        if (failReads.get()) {
            throw new IllegalStateException("Connection refused: " + name());
        }
    }

    public FaultInjectingStoreAdapter failNextWrites(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        failuresRemaining.set(count);
        return this;
    }

    public FaultInjectingStoreAdapter failAllWrites() {
        failAllWrites.set(true);
        return this;
    }

    public FaultInjectingStoreAdapter failReads(boolean fail) {
        failReads.set(fail);
        return this;
    }

    public FaultInjectingStoreAdapter delayWrites(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must be non-negative (current: " + millis + ")");
        }
        writeDelayMillis.set(millis);
        return this;
    }

    public FaultInjectingStoreAdapter stallNextWrite(CountDownLatch gate) {
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        stallGate.set(gate);
        return this;
    }

    /**
     * Clears every fault mode.
     */
    public FaultInjectingStoreAdapter recover() {
        failuresRemaining.set(0);
        failAllWrites.set(false);
        failReads.set(false);
        writeDelayMillis.set(0);
        stallGate.set(null);
        return this;
    }

    /**
     * @return number of write calls received, including failed ones
     */
    public int writeAttempts() {
        return writeAttempts.get();
    }

    public StoreAdapter getDelegate() {
        return delegate;
    }
}
