package com.ryuqq.dualwrite.adapter.inmemory.store;

import com.ryuqq.dualwrite.core.model.EntityKey;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.outcome.StoreResult;
import com.ryuqq.dualwrite.core.outcome.WriteErrorCode;
import com.ryuqq.dualwrite.core.spi.KeyPage;
import com.ryuqq.dualwrite.core.spi.StoreAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link StoreAdapter} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>tables:</strong> ConcurrentHashMap&lt;EntityType, ConcurrentSkipListMap&lt;EntityKey, Payload&gt;&gt;
 *       - one sorted table per entity type, giving ordered key scans</li>
 *   <li><strong>mutations:</strong> CopyOnWriteArrayList&lt;AppliedMutation&gt; - every applied write
 *       in apply order, for test assertions on ordering and duplicates</li>
 * </ul>
 *
 * <p><strong>Write Semantics:</strong></p>
 * <ul>
 *   <li>CREATE: {@code putIfAbsent}, rejected with DUPLICATE_KEY when the key exists</li>
 *   <li>UPDATE: upsert</li>
 *   <li>DELETE: {@code remove}, NotFound when the key is missing (not recorded as a mutation)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StoreAdapter primary = new InMemoryStoreAdapter("cart-db");
 * StoreAdapter secondary = new InMemoryStoreAdapter("legacy-shared");
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public class InMemoryStoreAdapter implements StoreAdapter {

    private final String name;

    private final ConcurrentHashMap<EntityType, ConcurrentSkipListMap<EntityKey, Payload>> tables;

    private final CopyOnWriteArrayList<AppliedMutation> mutations;

    /**
     * Creates an empty in-memory store.
     *
     * @param name store name used in logs
     * @throws IllegalArgumentException if name is null or blank
     */
    public InMemoryStoreAdapter(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.tables = new ConcurrentHashMap<>();
        this.mutations = new CopyOnWriteArrayList<>();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StoreResult put(EntityRef ref, OperationKind kind, Payload payload) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (kind == null || kind == OperationKind.DELETE) {
            throw new IllegalArgumentException("kind must be CREATE or UPDATE (current: " + kind + ")");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }

        ConcurrentSkipListMap<EntityKey, Payload> table = table(ref.entityType());
        if (kind == OperationKind.CREATE) {
            Payload existing = table.putIfAbsent(ref.entityKey(), payload);
            if (existing != null) {
                return StoreResult.rejected(WriteErrorCode.DUPLICATE_KEY,
                    "Entity already exists in " + name + ": " + ref);
            }
        } else {
            table.put(ref.entityKey(), payload);
        }
        mutations.add(new AppliedMutation(ref, kind, payload));
        return StoreResult.written();
    }

    @Override
    public StoreResult delete(EntityRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        Payload removed = table(ref.entityType()).remove(ref.entityKey());
        if (removed == null) {
            return StoreResult.notFound();
        }
        mutations.add(new AppliedMutation(ref, OperationKind.DELETE, Payload.empty()));
        return StoreResult.written();
    }

    @Override
    public Optional<Payload> get(EntityRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        ConcurrentSkipListMap<EntityKey, Payload> table = tables.get(ref.entityType());
        return table == null ? Optional.empty() : Optional.ofNullable(table.get(ref.entityKey()));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> uses {@code tailMap(after, false)} of the sorted
     * table and reads one extra key to decide {@code hasMore}.</p>
     */
    @Override
    public KeyPage scanKeys(EntityType entityType, EntityKey afterExclusive, int limit) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        ConcurrentSkipListMap<EntityKey, Payload> table = tables.get(entityType);
        if (table == null) {
            return KeyPage.empty();
        }
        NavigableMap<EntityKey, Payload> tail = afterExclusive == null ? table : table.tailMap(afterExclusive, false);
        List<EntityKey> keys = new ArrayList<>(limit);
        boolean hasMore = false;
        for (EntityKey key : tail.keySet()) {
            if (keys.size() == limit) {
                hasMore = true;
                break;
            }
            keys.add(key);
        }
        return new KeyPage(keys, hasMore);
    }

    private ConcurrentSkipListMap<EntityKey, Payload> table(EntityType entityType) {
        return tables.computeIfAbsent(entityType, type -> new ConcurrentSkipListMap<>());
    }

    /**
     * Seeds a value without recording a mutation.
     *
     * <p>This method is used to prepare drift scenarios in tests.</p>
     *
     * @param ref the entity
     * @param payload the value to store
     */
    public void seed(EntityRef ref, Payload payload) {
        if (ref == null || payload == null) {
            throw new IllegalArgumentException("ref and payload cannot be null");
        }
        table(ref.entityType()).put(ref.entityKey(), payload);
    }

    /**
     * Returns applied mutations in apply order.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return snapshot of the mutation log
     */
    public List<AppliedMutation> mutations() {
        return List.copyOf(mutations);
    }

    /**
     * Returns applied mutations for one entity in apply order.
     *
     * @param ref the entity
     * @return mutations of the entity
     */
    public List<AppliedMutation> mutationsOf(EntityRef ref) {
        return mutations.stream().filter(m -> m.ref().equals(ref)).toList();
    }

    /**
     * Number of stored entities of one type.
     *
     * @param entityType the entity type
     * @return entity count
     */
    public int count(EntityType entityType) {
        Map<EntityKey, Payload> table = tables.get(entityType);
        return table == null ? 0 : table.size();
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        tables.clear();
        mutations.clear();
    }

    /**
     * One write applied to this store.
     *
     * @param ref the entity
     * @param kind the applied kind
     * @param payload the written payload (empty for deletes)
     */
    public record AppliedMutation(EntityRef ref, OperationKind kind, Payload payload) {
    }
}
