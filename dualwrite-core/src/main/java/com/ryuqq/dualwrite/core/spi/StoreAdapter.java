package com.ryuqq.dualwrite.core.spi;

import com.ryuqq.dualwrite.core.model.EntityKey;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.outcome.StoreResult;

import java.util.Optional;

/**
 * Uniform I/O capability over one backing database (new store or legacy store).
 *
 * <p>One implementation exists per database. Adapters are pure I/O: they hold no
 * business logic and know nothing about the other store, retries or policy.</p>
 *
 * <p><strong>Write Semantics:</strong></p>
 * <pre>
 * put(ref, CREATE, payload) → Written | Rejected(DUPLICATE_KEY) if the key exists
 * put(ref, UPDATE, payload) → Written (inserts when the key is missing)
 * delete(ref)               → Written | NotFound if the key is missing
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Failures as values: report known failures as {@code Rejected}. Unexpected
 *       exceptions are tolerated and converted by the caller, but should be rare</li>
 *   <li>Thread-safe: methods are called concurrently for different keys</li>
 *   <li>Bounded latency: calls are wrapped with a per-call timeout by the engine; an
 *       adapter should honour thread interruption where its driver allows it</li>
 *   <li>Ordered scans: {@link #scanKeys} returns keys in ascending {@link EntityKey} order</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public interface StoreAdapter {

    /**
     * Human readable store name used in logs (e.g. "cart-db", "legacy-shared").
     *
     * @return store name
     */
    String name();

    /**
     * Writes the payload for the entity.
     *
     * @param ref target entity
     * @param kind CREATE or UPDATE
     * @param payload entity fields
     * @return write result
     * @throws IllegalArgumentException if any argument is null or kind is DELETE
     */
    StoreResult put(EntityRef ref, OperationKind kind, Payload payload);

    /**
     * Deletes the entity.
     *
     * @param ref target entity
     * @return {@code Written} when removed, {@code NotFound} when the key did not exist
     * @throws IllegalArgumentException if ref is null
     */
    StoreResult delete(EntityRef ref);

    /**
     * Reads the current payload of the entity.
     *
     * @param ref target entity
     * @return payload, or empty when absent
     * @throws IllegalArgumentException if ref is null
     */
    Optional<Payload> get(EntityRef ref);

    /**
     * Pages through the keys of one entity type in ascending order.
     *
     * <p>Used by the sync validator. The scan is not required to be a consistent
     * snapshot; keys written during a scan may or may not be returned.</p>
     *
     * @param entityType entity type to scan
     * @param afterExclusive resume position (null to start from the first key)
     * @param limit maximum number of keys to return (positive)
     * @return page of keys
     * @throws IllegalArgumentException if entityType is null or limit is not positive
     */
    KeyPage scanKeys(EntityType entityType, EntityKey afterExclusive, int limit);
}
