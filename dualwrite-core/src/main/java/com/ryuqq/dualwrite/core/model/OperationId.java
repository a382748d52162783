package com.ryuqq.dualwrite.core.model;

import java.util.UUID;

/**
 * 이중 쓰기 작업의 고유 식별자.
 *
 * <p>OperationId는 호출자가 제출한 하나의 논리적 쓰기 작업을 식별하며,
 * 동일 ID의 재제출은 재실행 없이 캐시된 결과를 반환하는 멱등성 키로도 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> UUID 형식의 문자열만 허용</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class OperationId {

    private final String value;

    private OperationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationId cannot be null or blank");
        }
        try {
            this.value = UUID.fromString(value).toString();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("OperationId must be a UUID (current: " + value + ")", e);
        }
    }

    /**
     * 문자열로부터 OperationId 생성.
     *
     * @param value UUID 형식 문자열
     * @return OperationId 인스턴스
     * @throws IllegalArgumentException null, 빈 문자열 또는 UUID 형식이 아닌 경우
     */
    public static OperationId of(String value) {
        return new OperationId(value);
    }

    /**
     * 랜덤 UUID 기반의 새 OperationId 생성.
     *
     * @return 새 OperationId
     */
    public static OperationId generate() {
        return new OperationId(UUID.randomUUID().toString());
    }

    /**
     * OperationId 값 조회.
     *
     * @return 정규화된 UUID 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationId that = (OperationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OperationId{" + value + '}';
    }
}
