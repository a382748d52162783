package com.ryuqq.dualwrite.core.model;

/**
 * 엔티티 종류 내에서 하나의 엔티티를 식별하는 키.
 *
 * <p>예: cart는 사용자 ID(u123), cart_item은 "cartId:productId" 형태의 복합 키.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~200자</li>
 * </ul>
 *
 * <p>키 간 순서는 문자열 사전순이며, 검증기의 페이지 스캔 순서로 사용됩니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class EntityKey implements Comparable<EntityKey> {

    private final String value;

    private EntityKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityKey cannot be null or blank");
        }
        if (value.length() > 200) {
            throw new IllegalArgumentException("EntityKey length cannot exceed 200 characters");
        }
        this.value = value;
    }

    /**
     * EntityKey 생성.
     *
     * @param value 키 값
     * @return EntityKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityKey of(String value) {
        return new EntityKey(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(EntityKey other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityKey that = (EntityKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityKey{" + value + '}';
    }
}
