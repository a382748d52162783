package com.ryuqq.dualwrite.core.validation;

import com.ryuqq.dualwrite.core.model.EntityType;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 엔티티 종류별 패리티 필드 선언 저장소.
 *
 * <p>검증 전에 모든 엔티티 종류가 등록되어 있어야 하며, 등록되지 않은 종류를
 * 검증하려 하면 {@link IllegalArgumentException}이 발생합니다.</p>
 *
 * <p>스레드 안전하며, 보통 애플리케이션 시작 시 한 번 채워집니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class ParityFieldRegistry {

    private final ConcurrentHashMap<EntityType, EntityParitySpec> specs = new ConcurrentHashMap<>();

    /**
     * 선언 등록.
     *
     * @param spec 엔티티 종류 선언
     * @return this
     * @throws IllegalArgumentException spec이 null이거나 같은 종류가 이미 등록된 경우
     */
    public ParityFieldRegistry register(EntityParitySpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        EntityParitySpec existing = specs.putIfAbsent(spec.getEntityType(), spec);
        if (existing != null) {
            throw new IllegalArgumentException(
                "Parity fields already registered for " + spec.getEntityType().getValue()
            );
        }
        return this;
    }

    public Optional<EntityParitySpec> find(EntityType entityType) {
        return Optional.ofNullable(specs.get(entityType));
    }

    /**
     * 등록된 선언 조회.
     *
     * @param entityType 엔티티 종류
     * @return 선언
     * @throws IllegalArgumentException 등록되지 않은 종류인 경우
     */
    public EntityParitySpec require(EntityType entityType) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        EntityParitySpec spec = specs.get(entityType);
        if (spec == null) {
            throw new IllegalArgumentException(
                "No parity fields registered for entity type: " + entityType.getValue()
            );
        }
        return spec;
    }

    /**
     * 등록된 엔티티 종류 (이름순).
     *
     * @return 엔티티 종류 집합
     */
    public Set<EntityType> registeredTypes() {
        Set<EntityType> types = new TreeSet<>((a, b) -> a.getValue().compareTo(b.getValue()));
        types.addAll(specs.keySet());
        return Collections.unmodifiableSet(types);
    }
}
