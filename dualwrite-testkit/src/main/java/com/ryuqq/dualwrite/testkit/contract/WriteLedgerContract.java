package com.ryuqq.dualwrite.testkit.contract;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.OverallStatus;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteErrorCode;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;
import com.ryuqq.dualwrite.core.spi.LedgerEntry;
import com.ryuqq.dualwrite.core.spi.WriteLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.dualwrite.testkit.OperationFixtures.create;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.operationAt;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.payload;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.ref;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract suite every {@link WriteLedger} implementation must pass.
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>At most one entry per operation id</li>
 *   <li>Outcomes are append-only and kept in append order</li>
 *   <li>An entry is completed exactly once</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public abstract class WriteLedgerContract {

    protected WriteLedger ledger;

    /**
     * @return a fresh, empty ledger
     */
    protected abstract WriteLedger createLedger();

    @BeforeEach
    void setUpLedger() {
        ledger = createLedger();
    }

    @Test
    void open_NewOperation_CreatesOpenEntry() {
        Operation op = create("cart", "u123", "items", List.of());

        assertTrue(ledger.open(op));

        LedgerEntry entry = ledger.find(op.operationId()).orElseThrow();
        assertEquals(op, entry.operation());
        assertTrue(entry.outcomes().isEmpty());
        assertFalse(entry.isCompleted());
        assertEquals(1, ledger.size());
    }

    @Test
    void open_SameOperationTwice_SecondReturnsFalse() {
        Operation op = create("cart", "u123");
        ledger.open(op);

        assertFalse(ledger.open(op), "At most one entry per operation id");
        assertEquals(1, ledger.size());
    }

    @Test
    void append_KeepsAppendOrder() {
        Operation op = create("cart", "u123");
        OperationId id = op.operationId();
        ledger.open(op);

        WriteOutcome primary = WriteOutcome.success(id, StoreRole.PRIMARY, 1L, 3, 1);
        WriteOutcome firstSecondary = WriteOutcome.failed(id, StoreRole.SECONDARY, WriteErrorCode.STORE_ERROR,
            "Connection refused", 2L, 5, 1);
        WriteOutcome secondSecondary = WriteOutcome.success(id, StoreRole.SECONDARY, 10L, 4, 2);
        ledger.append(id, primary);
        ledger.append(id, firstSecondary);
        ledger.append(id, secondSecondary);

        LedgerEntry entry = ledger.find(id).orElseThrow();
        assertEquals(List.of(primary, firstSecondary, secondSecondary), entry.outcomes());
        assertEquals(List.of(firstSecondary, secondSecondary), entry.outcomesFor(StoreRole.SECONDARY));
        assertEquals(secondSecondary, entry.latestSecondary().orElseThrow());
    }

    @Test
    void append_UnknownOperation_ThrowsIllegalState() {
        OperationId id = OperationId.generate();

        assertThrows(IllegalStateException.class,
            () -> ledger.append(id, WriteOutcome.success(id, StoreRole.PRIMARY, 1L, 1, 1)));
    }

    @Test
    void complete_StoresResultOnce() {
        Operation op = create("cart", "u123");
        OperationId id = op.operationId();
        ledger.open(op);
        WriteOutcome primary = WriteOutcome.success(id, StoreRole.PRIMARY, 1L, 1, 1);
        ledger.append(id, primary);
        DualWriteResult result = new DualWriteResult(id, OverallStatus.SUCCESS, primary, null, false);

        ledger.complete(id, result);

        assertEquals(result, ledger.find(id).orElseThrow().completedResult().orElseThrow());
        assertThrows(IllegalStateException.class, () -> ledger.complete(id, result));
    }

    @Test
    void complete_UnknownOperation_ThrowsIllegalState() {
        OperationId id = OperationId.generate();
        WriteOutcome primary = WriteOutcome.success(id, StoreRole.PRIMARY, 1L, 1, 1);

        assertThrows(IllegalStateException.class,
            () -> ledger.complete(id, new DualWriteResult(id, OverallStatus.SUCCESS, primary, null, false)));
    }

    @Test
    void findByEntity_ReturnsEntriesInSubmissionOrder() {
        EntityRef cart = ref("cart", "u123");
        Operation second = operationAt(OperationKind.UPDATE, cart, payload("items", List.of("a")), 2000L);
        Operation first = operationAt(OperationKind.CREATE, cart, payload("items", List.of()), 1000L);
        Operation other = operationAt(OperationKind.CREATE, ref("cart", "u999"), payload("items", List.of()), 1500L);
        ledger.open(second);
        ledger.open(first);
        ledger.open(other);

        List<LedgerEntry> entries = ledger.findByEntity(cart);

        assertEquals(List.of(first.operationId(), second.operationId()),
            entries.stream().map(entry -> entry.operation().operationId()).toList());
    }

    @Test
    void find_UnknownOperation_ReturnsEmpty() {
        assertTrue(ledger.find(OperationId.generate()).isEmpty());
    }
}
