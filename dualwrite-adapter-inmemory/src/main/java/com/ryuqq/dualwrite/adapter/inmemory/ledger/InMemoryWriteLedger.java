package com.ryuqq.dualwrite.adapter.inmemory.ledger;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;
import com.ryuqq.dualwrite.core.spi.LedgerEntry;
import com.ryuqq.dualwrite.core.spi.WriteLedger;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link WriteLedger} SPI.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ConcurrentHashMap&lt;OperationId, Entry&gt; - O(1) lookup, at most one entry per id</li>
 *   <li><strong>Entry.outcomes:</strong> CopyOnWriteArrayList&lt;WriteOutcome&gt; - append-only, lock-free reads</li>
 * </ul>
 *
 * <p>Only the holder of an entity's lease appends to that entity's entries, so a
 * concurrent map plus a concurrent list is enough to avoid lost updates.</p>
 *
 * <p><strong>Limitations:</strong> history is lost on restart and grows without bound.
 * Services that need retention should provide a persistent ledger.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public class InMemoryWriteLedger implements WriteLedger {

    private final ConcurrentHashMap<OperationId, Entry> entries = new ConcurrentHashMap<>();

    private final AtomicLong openOrder = new AtomicLong();

    @Override
    public boolean open(Operation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        Entry created = new Entry(operation, openOrder.incrementAndGet());
        return entries.putIfAbsent(operation.operationId(), created) == null;
    }

    @Override
    public void append(OperationId operationId, WriteOutcome outcome) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (!operationId.equals(outcome.operationId())) {
            throw new IllegalArgumentException(
                "outcome belongs to " + outcome.operationId() + ", not " + operationId
            );
        }
        requireEntry(operationId).outcomes.add(outcome);
    }

    @Override
    public void complete(OperationId operationId, DualWriteResult result) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        Entry entry = requireEntry(operationId);
        synchronized (entry) {
            if (entry.result != null) {
                throw new IllegalStateException("Ledger entry already completed for " + operationId);
            }
            entry.result = result;
        }
    }

    @Override
    public Optional<LedgerEntry> find(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        Entry entry = entries.get(operationId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    @Override
    public List<LedgerEntry> findByEntity(EntityRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        return entries.values().stream()
            .filter(entry -> entry.operation.ref().equals(ref))
            .sorted(Comparator.comparingLong((Entry entry) -> entry.operation.submittedAt())
                .thenComparingLong(entry -> entry.order))
            .map(Entry::snapshot)
            .toList();
    }

    @Override
    public int size() {
        return entries.size();
    }

    /**
     * Clears all entries.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        entries.clear();
    }

    private Entry requireEntry(OperationId operationId) {
        Entry entry = entries.get(operationId);
        if (entry == null) {
            throw new IllegalStateException("No ledger entry for " + operationId);
        }
        return entry;
    }

    private static final class Entry {

        private final Operation operation;
        private final long order;
        private final CopyOnWriteArrayList<WriteOutcome> outcomes = new CopyOnWriteArrayList<>();
        private volatile DualWriteResult result;

        private Entry(Operation operation, long order) {
            this.operation = operation;
            this.order = order;
        }

        private LedgerEntry snapshot() {
            return new LedgerEntry(operation, List.copyOf(outcomes), result);
        }
    }
}
