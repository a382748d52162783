package com.ryuqq.dualwrite.core.spi;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.retry.RetryTask;

import java.util.List;
import java.util.Optional;

/**
 * Storage for pending retry tasks.
 *
 * <p>Only PENDING tasks live here; the retry queue removes a task when it reaches a
 * terminal state. Whether tasks survive a process restart depends on the
 * implementation (in-memory vs. file backed).</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: the coordinator enqueues while the drain loop processes</li>
 *   <li>Ordered: {@link #findAllPending()} returns tasks in ascending sequence</li>
 *   <li>Monotonic sequence: {@link #nextSequence()} never returns a value already used,
 *       including values used before a restart for durable implementations</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public interface RetryTaskStore {

    /**
     * Allocates the next task sequence number.
     *
     * @return a sequence greater than any previously allocated one
     */
    long nextSequence();

    /**
     * Inserts or replaces the task with the same operation id.
     *
     * @param task pending task
     * @throws IllegalArgumentException if task is null or not PENDING
     */
    void save(RetryTask task);

    /**
     * Removes the task of an operation.
     *
     * @param operationId operation id
     * @return true if a task was removed
     */
    boolean remove(OperationId operationId);

    Optional<RetryTask> find(OperationId operationId);

    /**
     * All pending tasks in ascending sequence order.
     *
     * @return pending tasks
     */
    List<RetryTask> findAllPending();

    /**
     * Pending tasks of one entity type in ascending sequence order.
     *
     * @param entityType entity type
     * @return pending tasks
     */
    List<RetryTask> findByEntityType(EntityType entityType);

    /**
     * Whether any task is pending for the entity.
     *
     * @param ref entity
     * @return true if at least one task is pending
     */
    boolean hasPending(EntityRef ref);

    int size();
}
