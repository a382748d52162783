package com.ryuqq.dualwrite.core.spi;

import com.ryuqq.dualwrite.core.model.EntityKey;

import java.util.List;

/**
 * One page of keys returned by {@link StoreAdapter#scanKeys}.
 *
 * @param keys keys in ascending order
 * @param hasMore whether more keys exist after the last one
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record KeyPage(List<EntityKey> keys, boolean hasMore) {

    public KeyPage {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        keys = List.copyOf(keys);
    }

    public static KeyPage empty() {
        return new KeyPage(List.of(), false);
    }

    /**
     * Last key of the page, used as the next resume position.
     *
     * @return last key, or null when the page is empty
     */
    public EntityKey lastKey() {
        return keys.isEmpty() ? null : keys.get(keys.size() - 1);
    }
}
