package com.ryuqq.dualwrite.adapter.inmemory.retry;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.retry.RetryTask;
import com.ryuqq.dualwrite.core.retry.RetryTaskState;
import com.ryuqq.dualwrite.core.spi.RetryTaskStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link RetryTaskStore} SPI.
 *
 * <p><strong>Durability gap:</strong> pending retries are lost when the process stops.
 * The affected entities stay divergent until the next validation pass reports them.
 * Use {@code JsonFileRetryTaskStore} where retries must survive a restart.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public class InMemoryRetryTaskStore implements RetryTaskStore {

    private static final Comparator<RetryTask> BY_SEQUENCE = Comparator.comparingLong(RetryTask::sequence);

    private final ConcurrentHashMap<OperationId, RetryTask> tasks = new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    @Override
    public void save(RetryTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (task.state() != RetryTaskState.PENDING) {
            throw new IllegalArgumentException("Only PENDING tasks can be stored (current: " + task.state() + ")");
        }
        tasks.put(task.operationId(), task);
    }

    @Override
    public boolean remove(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        return tasks.remove(operationId) != null;
    }

    @Override
    public Optional<RetryTask> find(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        return Optional.ofNullable(tasks.get(operationId));
    }

    @Override
    public List<RetryTask> findAllPending() {
        return tasks.values().stream().sorted(BY_SEQUENCE).toList();
    }

    @Override
    public List<RetryTask> findByEntityType(EntityType entityType) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        return tasks.values().stream()
            .filter(task -> task.ref().entityType().equals(entityType))
            .sorted(BY_SEQUENCE)
            .toList();
    }

    @Override
    public boolean hasPending(EntityRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        return tasks.values().stream().anyMatch(task -> task.ref().equals(ref));
    }

    @Override
    public int size() {
        return tasks.size();
    }

    /**
     * Clears all tasks.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        tasks.clear();
    }
}
