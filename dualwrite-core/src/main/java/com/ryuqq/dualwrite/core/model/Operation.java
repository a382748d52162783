package com.ryuqq.dualwrite.core.model;

/**
 * 호출자가 제출하는 하나의 논리적 쓰기 작업.
 *
 * <p>Operation은 제출 후 불변이며, 두 스토어에 동일하게 적용됩니다.
 * {@code (entityType, entityKey)}가 직렬화 범위를 결정합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>CREATE/UPDATE는 payload 필수</li>
 *   <li>DELETE의 payload는 {@link Payload#empty()}로 정규화</li>
 *   <li>submittedAt은 0 이상 (epoch millis)</li>
 * </ul>
 *
 * @param operationId 작업 ID (멱등성 키)
 * @param ref 대상 엔티티
 * @param kind 작업 종류
 * @param payload 엔티티 데이터
 * @param submittedAt 제출 시각 (epoch millis)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record Operation(
    OperationId operationId,
    EntityRef ref,
    OperationKind kind,
    Payload payload,
    long submittedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 submittedAt이 음수인 경우
     */
    public Operation {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.carriesPayload() && payload == null) {
            throw new IllegalArgumentException("payload cannot be null for " + kind);
        }
        if (!kind.carriesPayload()) {
            payload = Payload.empty();
        }
        if (submittedAt < 0) {
            throw new IllegalArgumentException(
                "submittedAt must be non-negative (current: " + submittedAt + ")"
            );
        }
    }

    /**
     * 새 ID와 현재 시각으로 CREATE 작업 생성.
     */
    public static Operation create(EntityRef ref, Payload payload) {
        return new Operation(OperationId.generate(), ref, OperationKind.CREATE, payload, System.currentTimeMillis());
    }

    /**
     * 새 ID와 현재 시각으로 UPDATE 작업 생성.
     */
    public static Operation update(EntityRef ref, Payload payload) {
        return new Operation(OperationId.generate(), ref, OperationKind.UPDATE, payload, System.currentTimeMillis());
    }

    /**
     * 새 ID와 현재 시각으로 DELETE 작업 생성.
     */
    public static Operation delete(EntityRef ref) {
        return new Operation(OperationId.generate(), ref, OperationKind.DELETE, Payload.empty(), System.currentTimeMillis());
    }

    public EntityType entityType() {
        return ref.entityType();
    }

    public EntityKey entityKey() {
        return ref.entityKey();
    }
}
