package com.ryuqq.dualwrite.application.coordinator;

import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.outcome.DualWriteResult;

/**
 * 하나의 논리적 쓰기를 두 스토어에 적용하는 조정자.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Operation op = Operation.create(EntityRef.of("cart", "u123"), Payload.of(Map.of("items", List.of())));
 * DualWriteResult result = coordinator.execute(op);
 *
 * if (result.isFailed()) {
 *     // primary 실패: 쓰기가 일어났다고 가정하면 안 됨
 * } else if (result.isPartialSuccess()) {
 *     // 레거시 반영은 재시도 큐에서 계속됨 (로그만 남기고 진행)
 * }
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public interface DualWriteCoordinator {

    /**
     * 작업을 실행하고 구조화된 결과를 반환.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>(entityType, entityKey) 단위 lease 획득</li>
     *   <li>같은 operationId의 완료된 결과가 있으면 재실행 없이 반환</li>
     *   <li>primary 쓰기. 실패하면 secondary는 시도하지 않고 FAILED 반환</li>
     *   <li>secondary 쓰기 (동기) 또는 재시도 큐 등록 (비동기)</li>
     *   <li>원장 기록 후 lease 해제</li>
     * </ol>
     *
     * <p>스토어 실패는 예외가 아닌 결과 값으로 반환됩니다.</p>
     *
     * @param operation 실행할 작업
     * @return 이중 쓰기 결과
     * @throws IllegalArgumentException operation이 null인 경우
     * @throws IllegalStateException 같은 operationId가 다른 키로 실행 중인 경우
     */
    DualWriteResult execute(Operation operation);
}
