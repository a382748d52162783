package com.ryuqq.dualwrite.core.spi;

import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the history of one operation: the operation itself, every write
 * attempt it accumulated across retries, and the result returned to the caller.
 *
 * @param operation the submitted operation
 * @param outcomes write attempts in append order
 * @param result result returned to the caller (null while the operation is in flight)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record LedgerEntry(Operation operation, List<WriteOutcome> outcomes, DualWriteResult result) {

    public LedgerEntry {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        outcomes = List.copyOf(outcomes);
    }

    public boolean isCompleted() {
        return result != null;
    }

    public Optional<DualWriteResult> completedResult() {
        return Optional.ofNullable(result);
    }

    public List<WriteOutcome> outcomesFor(StoreRole store) {
        return outcomes.stream().filter(o -> o.store() == store).toList();
    }

    /**
     * Most recent secondary attempt, including those appended by the retry queue.
     *
     * @return latest secondary outcome, or empty when none was recorded
     */
    public Optional<WriteOutcome> latestSecondary() {
        List<WriteOutcome> secondary = outcomesFor(StoreRole.SECONDARY);
        return secondary.isEmpty() ? Optional.empty() : Optional.of(secondary.get(secondary.size() - 1));
    }
}
