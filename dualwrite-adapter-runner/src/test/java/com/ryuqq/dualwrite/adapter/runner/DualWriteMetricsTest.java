package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.application.retry.RetryQueue;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;
import com.ryuqq.dualwrite.core.outcome.OverallStatus;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * DualWriteMetrics 테스트.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class DualWriteMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final DualWriteMetrics metrics = new DualWriteMetrics(registry);

    @Test
    void recordOperation_전체_상태별_카운터_증가() {
        // given
        OperationId id = OperationId.generate();
        DualWriteResult result = new DualWriteResult(id, OverallStatus.SUCCESS,
            WriteOutcome.success(id, StoreRole.PRIMARY, 1L, 1L, 1), null, true);

        // when
        metrics.recordOperation(result);
        metrics.recordOperation(result);

        // then
        assertThat(metrics.operationCount(OverallStatus.SUCCESS)).isEqualTo(2);
        assertThat(metrics.operationCount(OverallStatus.FAILED)).isZero();
        assertThat(registry.get("dualwrite.operations").tag("overall", "SUCCESS").counter().count()).isEqualTo(2.0);
    }

    @Test
    void 검증_패스_전에는_완료_시각이_없음() {
        assertThat(metrics.lastValidationCompletedAt()).isNull();

        metrics.recordValidationPass(42_000L, 3);

        assertThat(metrics.lastValidationCompletedAt()).isEqualTo(42_000L);
        assertThat(metrics.lastValidationMismatchCount()).isEqualTo(3);
        assertThat(metrics.validationPassCount()).isEqualTo(1);
        assertThat(registry.get("dualwrite.validation.mismatches").gauge().value()).isEqualTo(3.0);
    }

    @Test
    void 재시도_카운터와_큐_깊이_게이지() {
        // given
        RetryQueue retryQueue = mock(RetryQueue.class);
        when(retryQueue.depth()).thenReturn(7);
        metrics.bindRetryQueue(retryQueue);

        // when
        metrics.recordRetryResolved();
        metrics.recordRetryAbandoned();
        metrics.recordRetryAbandoned();
        metrics.recordValidationError();

        // then
        assertThat(metrics.resolvedRetryCount()).isEqualTo(1);
        assertThat(metrics.abandonedRetryCount()).isEqualTo(2);
        assertThat(metrics.validationErrorCount()).isEqualTo(1);
        assertThat(registry.get("dualwrite.retry.depth").gauge().value()).isEqualTo(7.0);
    }
}
