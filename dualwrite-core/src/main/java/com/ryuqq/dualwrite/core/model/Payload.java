package com.ryuqq.dualwrite.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 쓰기 작업이 운반하는 엔티티 데이터.
 *
 * <p>엔진은 payload의 내용을 해석하지 않으며, 호출자가 완성된 필드 맵을 전달합니다.
 * 필드 순서는 입력 순서를 유지하고, null 값을 허용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Payload.of(Map.of("items", List.of()))
 * Payload.builder().put("name", "Keyboard").put("price", new BigDecimal("39.90")).build()
 * </pre>
 *
 * <p><strong>불변성:</strong> 입력 맵을 복사하여 보관하며, 외부 변경이 반영되지 않음.
 * 단, 중첩된 컬렉션 값은 호출자가 불변으로 전달해야 합니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Collections.emptyMap());

    private final Map<String, Object> fields;

    private Payload(Map<String, Object> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("field name cannot be null");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.fields = Collections.unmodifiableMap(copy);
    }

    /**
     * 필드 맵으로부터 Payload 생성.
     *
     * @param fields 필드 맵
     * @return Payload 인스턴스
     * @throws IllegalArgumentException fields가 null이거나 null 필드명을 포함하는 경우
     */
    public static Payload of(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        return new Payload(new LinkedHashMap<>(fields));
    }

    /**
     * 빈 Payload.
     *
     * @return 필드가 없는 Payload
     */
    public static Payload empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 전체 필드 조회.
     *
     * @return 수정 불가능한 필드 맵
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    /**
     * 단일 필드 값 조회.
     *
     * @param field 필드명
     * @return 필드 값 (없거나 null이면 null)
     */
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return fields.equals(payload.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + fields.keySet() + '}';
    }

    /**
     * Payload 빌더.
     */
    public static final class Builder {

        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String field, Object value) {
            if (field == null) {
                throw new IllegalArgumentException("field name cannot be null");
            }
            fields.put(field, value);
            return this;
        }

        public Payload build() {
            return new Payload(fields);
        }
    }
}
