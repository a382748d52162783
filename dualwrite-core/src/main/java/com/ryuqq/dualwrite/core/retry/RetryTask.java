package com.ryuqq.dualwrite.core.retry;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;

/**
 * secondary 스토어에 다시 적용해야 하는 쓰기 작업.
 *
 * <p>동기 secondary 쓰기가 비치명적으로 실패했거나, 비동기 레거시 모드에서
 * secondary 쓰기를 지연할 때 생성됩니다. 재시도 큐만 이 객체의 생명주기를 소유합니다.</p>
 *
 * <p><strong>순서 보장:</strong> {@code sequence}는 전역 단조 증가 값이며,
 * 같은 키의 작업은 sequence 순서로만 처리됩니다.</p>
 *
 * <p><strong>attemptCount:</strong> 지금까지 수행된 secondary 시도 횟수.
 * 동기 경로의 최초 시도도 1회로 계산합니다. 비동기 지연 작업은 0에서 시작합니다.</p>
 *
 * @param operationId 원본 작업 ID
 * @param ref 대상 엔티티
 * @param kind 작업 종류
 * @param payload 엔티티 데이터
 * @param submittedAt 원본 작업 제출 시각 (epoch millis)
 * @param sequence 전역 순서 번호
 * @param attemptCount 수행된 시도 횟수
 * @param nextAttemptAt 다음 시도 가능 시각 (epoch millis)
 * @param createdAt 재시도 작업 생성 시각 (epoch millis)
 * @param lastError 마지막 실패 메시지 (null 가능)
 * @param state 생명주기 상태
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record RetryTask(
    OperationId operationId,
    EntityRef ref,
    OperationKind kind,
    Payload payload,
    long submittedAt,
    long sequence,
    int attemptCount,
    long nextAttemptAt,
    long createdAt,
    String lastError,
    RetryTaskState state
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 수치가 범위를 벗어난 경우
     */
    public RetryTask {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be non-negative (current: " + attemptCount + ")");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
    }

    /**
     * 작업으로부터 대기 상태의 재시도 작업 생성.
     *
     * @param operation 원본 작업
     * @param sequence 전역 순서 번호
     * @param attemptCount 이미 수행된 시도 횟수
     * @param nextAttemptAt 첫 재시도 가능 시각
     * @param createdAt 생성 시각
     * @param lastError 마지막 실패 메시지 (null 가능)
     * @return PENDING 상태의 RetryTask
     */
    public static RetryTask pending(Operation operation, long sequence, int attemptCount,
                                    long nextAttemptAt, long createdAt, String lastError) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return new RetryTask(operation.operationId(), operation.ref(), operation.kind(), operation.payload(),
            operation.submittedAt(), sequence, attemptCount, nextAttemptAt, createdAt, lastError,
            RetryTaskState.PENDING);
    }

    /**
     * 원본 Operation 복원.
     *
     * @return 이 작업을 만든 Operation
     */
    public Operation toOperation() {
        return new Operation(operationId, ref, kind, payload, submittedAt);
    }

    public boolean isDue(long now) {
        return state == RetryTaskState.PENDING && nextAttemptAt <= now;
    }

    /**
     * 실패 후 다음 시도를 예약한 사본.
     *
     * @param nextAttemptAt 다음 시도 시각
     * @param error 실패 메시지
     * @return attemptCount가 1 증가한 PENDING 작업
     */
    public RetryTask rescheduled(long nextAttemptAt, String error) {
        RetryTaskTransition.validate(state, RetryTaskState.PENDING);
        return new RetryTask(operationId, ref, kind, payload, submittedAt, sequence, attemptCount + 1,
            nextAttemptAt, createdAt, error, RetryTaskState.PENDING);
    }

    /**
     * 종료 상태로 전이한 사본.
     *
     * @param terminal RESOLVED, ABANDONED, CANCELLED 중 하나
     * @param attempts 최종 시도 횟수
     * @param error 마지막 실패 메시지 (null 가능)
     * @return 종료 상태의 작업
     */
    public RetryTask terminated(RetryTaskState terminal, int attempts, String error) {
        if (terminal == null || !terminal.isTerminal()) {
            throw new IllegalArgumentException("terminal state required (current: " + terminal + ")");
        }
        RetryTaskTransition.validate(state, terminal);
        return new RetryTask(operationId, ref, kind, payload, submittedAt, sequence, attempts,
            nextAttemptAt, createdAt, error, terminal);
    }
}
