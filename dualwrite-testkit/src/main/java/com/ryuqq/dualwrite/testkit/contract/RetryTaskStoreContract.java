package com.ryuqq.dualwrite.testkit.contract;

import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.retry.RetryTask;
import com.ryuqq.dualwrite.core.retry.RetryTaskState;
import com.ryuqq.dualwrite.core.spi.RetryTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.dualwrite.testkit.OperationFixtures.create;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.delete;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.ref;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.update;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract suite every {@link RetryTaskStore} implementation must pass.
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Sequences increase monotonically</li>
 *   <li>Only PENDING tasks are stored; saving the same operation id replaces the task</li>
 *   <li>Pending tasks are listed in sequence order</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public abstract class RetryTaskStoreContract {

    protected RetryTaskStore store;

    /**
     * @return a fresh, empty task store
     */
    protected abstract RetryTaskStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    protected RetryTask pendingTask(Operation operation) {
        return RetryTask.pending(operation, store.nextSequence(), 1, 5_000L, 1_000L, "Connection refused");
    }

    @Test
    void nextSequence_IsMonotonic() {
        long first = store.nextSequence();
        long second = store.nextSequence();
        long third = store.nextSequence();

        assertTrue(first < second && second < third,
            "Sequences must increase: " + first + ", " + second + ", " + third);
    }

    @Test
    void save_ThenFind_ReturnsTask() {
        RetryTask task = pendingTask(create("cart", "u123"));

        store.save(task);

        assertEquals(task, store.find(task.operationId()).orElseThrow());
        assertEquals(1, store.size());
        assertTrue(store.hasPending(ref("cart", "u123")));
    }

    @Test
    void save_TerminalTask_Rejected() {
        RetryTask task = pendingTask(create("cart", "u123"));
        RetryTask abandoned = task.terminated(RetryTaskState.ABANDONED, 5, "gone");

        assertThrows(IllegalArgumentException.class, () -> store.save(abandoned));
        assertEquals(0, store.size());
    }

    @Test
    void save_SameOperation_ReplacesTask() {
        RetryTask task = pendingTask(create("cart", "u123"));
        store.save(task);

        RetryTask rescheduled = task.rescheduled(9_000L, "Timeout");
        store.save(rescheduled);

        RetryTask stored = store.find(task.operationId()).orElseThrow();
        assertEquals(2, stored.attemptCount());
        assertEquals(9_000L, stored.nextAttemptAt());
        assertEquals(task.sequence(), stored.sequence(), "Rescheduling keeps the original sequence");
        assertEquals(1, store.size());
    }

    @Test
    void remove_DeletesTask() {
        RetryTask task = pendingTask(create("cart", "u123"));
        store.save(task);

        assertTrue(store.remove(task.operationId()));
        assertFalse(store.remove(task.operationId()));
        assertTrue(store.find(task.operationId()).isEmpty());
        assertFalse(store.hasPending(ref("cart", "u123")));
    }

    @Test
    void findAllPending_OrderedBySequence() {
        RetryTask first = pendingTask(create("cart", "u1"));
        RetryTask second = pendingTask(update("cart", "u1", "items", List.of("a")));
        RetryTask third = pendingTask(delete("cart", "u2"));
        store.save(third);
        store.save(first);
        store.save(second);

        assertEquals(List.of(first.operationId(), second.operationId(), third.operationId()),
            store.findAllPending().stream().map(RetryTask::operationId).toList());
    }

    @Test
    void findByEntityType_FiltersByType() {
        RetryTask cart = pendingTask(create("cart", "u1"));
        RetryTask product = pendingTask(create("product", "p1"));
        store.save(cart);
        store.save(product);

        List<RetryTask> carts = store.findByEntityType(EntityType.of("cart"));

        assertEquals(List.of(cart), carts);
    }
}
