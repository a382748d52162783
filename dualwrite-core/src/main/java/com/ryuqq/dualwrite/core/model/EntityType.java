package com.ryuqq.dualwrite.core.model;

import java.util.regex.Pattern;

/**
 * 엔티티 종류 식별자.
 *
 * <p>cart, cart_item, product, user 등 이중 쓰기 대상 엔티티의 종류를 나타냅니다.
 * 패리티 필드 등록, 키 스캔, 재시도 일괄 취소의 단위로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>소문자로 시작, 소문자/숫자/밑줄만 허용</li>
 *   <li>길이: 1~50자</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class EntityType {

    private static final Pattern VALID_NAME = Pattern.compile("^[a-z][a-z0-9_]*$");

    private final String value;

    private EntityType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityType cannot be null or blank");
        }
        if (value.length() > 50) {
            throw new IllegalArgumentException("EntityType length cannot exceed 50 characters");
        }
        if (!VALID_NAME.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "EntityType must be lower snake case (current: " + value + ")"
            );
        }
        this.value = value;
    }

    /**
     * EntityType 생성.
     *
     * @param value 엔티티 종류 이름
     * @return EntityType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityType of(String value) {
        return new EntityType(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityType that = (EntityType) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityType{" + value + '}';
    }
}
