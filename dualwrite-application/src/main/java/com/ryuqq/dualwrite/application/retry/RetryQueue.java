package com.ryuqq.dualwrite.application.retry;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.retry.RetryTask;

import java.util.List;
import java.util.OptionalLong;

/**
 * 비치명적으로 실패했거나 지연된 secondary 쓰기의 재시도 큐.
 *
 * <p>큐는 RetryTask 생명주기를 소유하며, 최초 시도 이후의 secondary 결과를
 * 원장에 기록하는 유일한 주체입니다. 배수(drain)는 별도의
 * {@link com.ryuqq.dualwrite.application.runtime.Runtime#pump()} 주기로 실행됩니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public interface RetryQueue {

    /**
     * 작업의 secondary 쓰기를 큐에 등록.
     *
     * @param operation 원본 작업
     * @param attemptsMade 이미 수행된 secondary 시도 횟수 (비동기 지연이면 0)
     * @param lastError 마지막 실패 메시지 (null 가능)
     * @return 등록된 작업
     * @throws IllegalArgumentException operation이 null이거나 attemptsMade가 음수인 경우
     */
    RetryTask enqueue(Operation operation, int attemptsMade, String lastError);

    /**
     * 이미 만들어진 작업 등록 (운영 도구의 수동 재등록용).
     *
     * @param task PENDING 작업
     * @throws IllegalArgumentException task가 null이거나 PENDING이 아닌 경우
     */
    void enqueue(RetryTask task);

    /**
     * 엔티티에 대기 중인 작업이 있는지 확인.
     *
     * @param ref 엔티티
     * @return 대기 작업이 있으면 true
     */
    boolean hasPending(EntityRef ref);

    /**
     * 작업 하나 취소.
     *
     * @param operationId 작업 ID
     * @return 취소되었으면 true
     */
    boolean cancel(OperationId operationId);

    /**
     * 엔티티 종류의 대기 작업 전체 취소 (운영자 기능).
     *
     * @param entityType 엔티티 종류
     * @return 취소된 작업 수
     */
    int cancelAll(EntityType entityType);

    int depth();

    /**
     * 가장 오래 대기 중인 작업의 대기 시간.
     *
     * @return 대기 시간 (밀리초), 대기 작업이 없으면 empty
     */
    OptionalLong oldestPendingAgeMillis();

    List<RetryTask> pending();

    /**
     * 최근 포기된 작업 (최대 100건, 최신순).
     *
     * @return 포기된 작업 목록
     */
    List<RetryTask> abandoned();
}
