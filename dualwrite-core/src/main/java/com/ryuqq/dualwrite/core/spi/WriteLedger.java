package com.ryuqq.dualwrite.core.spi;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Append-only record of attempted operations and their per-store outcomes.
 *
 * <p>The ledger is the single shared source of truth for "what happened". It backs
 * idempotent resubmission, audit and manual inspection.</p>
 *
 * <p><strong>Lifecycle of an entry:</strong></p>
 * <pre>
 * open(operation)          → entry created, no outcomes
 * append(id, outcome) × N  → primary attempt, secondary attempts, retry attempts
 * complete(id, result)     → result fixed once; later appends still allowed (retries)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>At most one entry per operation id</li>
 *   <li>Append-only: outcomes are never mutated or removed once appended</li>
 *   <li>Concurrent appends to different entries must not lose updates</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public interface WriteLedger {

    /**
     * Creates the entry for an operation if none exists.
     *
     * @param operation the operation
     * @return true if a new entry was created, false if one already existed
     * @throws IllegalArgumentException if operation is null
     */
    boolean open(Operation operation);

    /**
     * Appends a write attempt to an existing entry.
     *
     * @param operationId the operation id
     * @param outcome the attempt to append
     * @throws IllegalArgumentException if any argument is null or the outcome belongs to another operation
     * @throws IllegalStateException if no entry exists for the operation id
     */
    void append(OperationId operationId, WriteOutcome outcome);

    /**
     * Fixes the caller-facing result of an entry.
     *
     * @param operationId the operation id
     * @param result the result returned to the caller
     * @throws IllegalStateException if no entry exists or the entry is already completed
     */
    void complete(OperationId operationId, DualWriteResult result);

    /**
     * Finds the entry of an operation.
     *
     * @param operationId the operation id
     * @return snapshot of the entry, or empty
     */
    Optional<LedgerEntry> find(OperationId operationId);

    /**
     * Lists all entries addressing one entity, in submission order.
     *
     * @param ref the entity
     * @return entry snapshots
     */
    List<LedgerEntry> findByEntity(EntityRef ref);

    /**
     * Number of entries.
     *
     * @return entry count
     */
    int size();
}
