package com.ryuqq.dualwrite.core.model;

/**
 * (EntityType, EntityKey) 복합 키.
 *
 * <p>키 단위 직렬화(lease), 스토어 어댑터 호출, 재시도 순서 보장의 단위입니다.
 * 같은 EntityRef를 대상으로 하는 두 작업은 절대 동시에 실행되지 않습니다.</p>
 *
 * @param entityType 엔티티 종류
 * @param entityKey 엔티티 키
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record EntityRef(EntityType entityType, EntityKey entityKey) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException entityType 또는 entityKey가 null인 경우
     */
    public EntityRef {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        if (entityKey == null) {
            throw new IllegalArgumentException("entityKey cannot be null");
        }
    }

    /**
     * 문자열로부터 EntityRef 생성.
     *
     * @param entityType 엔티티 종류 이름
     * @param entityKey 엔티티 키 값
     * @return EntityRef 인스턴스
     */
    public static EntityRef of(String entityType, String entityKey) {
        return new EntityRef(EntityType.of(entityType), EntityKey.of(entityKey));
    }

    @Override
    public String toString() {
        return entityType.getValue() + "/" + entityKey.getValue();
    }
}
