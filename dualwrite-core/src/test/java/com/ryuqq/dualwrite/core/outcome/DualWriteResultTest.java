package com.ryuqq.dualwrite.core.outcome;

import com.ryuqq.dualwrite.core.model.OperationId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DualWriteResult 불변식 테스트.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class DualWriteResultTest {

    private final OperationId id = OperationId.generate();
    private final WriteOutcome primaryOk = WriteOutcome.success(id, StoreRole.PRIMARY, 1L, 1L, 1);
    private final WriteOutcome primaryFailed = WriteOutcome.failed(id, StoreRole.PRIMARY,
        WriteErrorCode.STORE_ERROR, "down", 1L, 1L, 1);
    private final WriteOutcome secondaryOk = WriteOutcome.success(id, StoreRole.SECONDARY, 1L, 1L, 1);
    private final WriteOutcome secondaryFailed = WriteOutcome.failed(id, StoreRole.SECONDARY,
        WriteErrorCode.STORE_ERROR, "down", 1L, 1L, 1);

    @Test
    void partialSuccess_ReportsSecondaryAsFailedStore() {
        DualWriteResult result = new DualWriteResult(id, OverallStatus.PARTIAL_SUCCESS, primaryOk, secondaryFailed, false);

        assertTrue(result.isPartialSuccess());
        assertEquals(StoreRole.SECONDARY, result.failedStore().orElseThrow());
    }

    @Test
    void primaryFailure_ReportsPrimaryAsFailedStore() {
        DualWriteResult result = new DualWriteResult(id, OverallStatus.FAILED, primaryFailed, null, false);

        assertTrue(result.isFailed());
        assertEquals(StoreRole.PRIMARY, result.failedStore().orElseThrow());
        assertTrue(result.secondaryOutcome().isEmpty());
    }

    @Test
    void success_HasNoFailedStore() {
        DualWriteResult result = new DualWriteResult(id, OverallStatus.SUCCESS, primaryOk, secondaryOk, false);

        assertTrue(result.isSuccess());
        assertTrue(result.failedStore().isEmpty());
    }

    @Test
    void primaryFailureWithSuccessStatus_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new DualWriteResult(id, OverallStatus.SUCCESS, primaryFailed, null, false));
    }

    @Test
    void partialSuccessWithoutSecondaryFailure_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new DualWriteResult(id, OverallStatus.PARTIAL_SUCCESS, primaryOk, secondaryOk, false));
    }

    @Test
    void deferredWithSecondaryOutcome_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new DualWriteResult(id, OverallStatus.SUCCESS, primaryOk, secondaryOk, true));
    }

    @Test
    void swappedRoles_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new DualWriteResult(id, OverallStatus.SUCCESS, secondaryOk, null, false));
    }
}
