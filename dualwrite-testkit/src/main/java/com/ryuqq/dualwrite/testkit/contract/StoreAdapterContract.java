package com.ryuqq.dualwrite.testkit.contract;

import com.ryuqq.dualwrite.core.model.EntityKey;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.outcome.NotFound;
import com.ryuqq.dualwrite.core.outcome.Rejected;
import com.ryuqq.dualwrite.core.outcome.StoreResult;
import com.ryuqq.dualwrite.core.outcome.WriteErrorCode;
import com.ryuqq.dualwrite.core.spi.KeyPage;
import com.ryuqq.dualwrite.core.spi.StoreAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.ryuqq.dualwrite.testkit.OperationFixtures.payload;
import static com.ryuqq.dualwrite.testkit.OperationFixtures.ref;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract suite every {@link StoreAdapter} implementation must pass.
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>CREATE on an existing key is rejected with DUPLICATE_KEY and leaves the value untouched</li>
 *   <li>UPDATE upserts</li>
 *   <li>DELETE on a missing key returns NotFound</li>
 *   <li>scanKeys pages keys of one entity type in ascending order</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreAdapterContractTest extends StoreAdapterContract {
 *     {@literal @}Override
 *     protected StoreAdapter createAdapter() {
 *         return new MyStoreAdapter(...);
 *     }
 * }
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public abstract class StoreAdapterContract {

    protected StoreAdapter adapter;

    /**
     * @return a fresh, empty adapter
     */
    protected abstract StoreAdapter createAdapter();

    @BeforeEach
    void setUpAdapter() {
        adapter = createAdapter();
    }

    @Test
    void create_NewKey_WrittenAndReadable() {
        EntityRef ref = ref("product", "p-1");
        Payload value = payload("name", "Kettle", "price", 19.99);

        StoreResult result = adapter.put(ref, OperationKind.CREATE, value);

        assertTrue(result.isSuccessful(), "CREATE on a new key should succeed");
        assertEquals(Optional.of(value), adapter.get(ref));
    }

    @Test
    void create_ExistingKey_RejectedWithDuplicateKey() {
        EntityRef ref = ref("product", "p-1");
        Payload original = payload("name", "Kettle");
        adapter.put(ref, OperationKind.CREATE, original);

        StoreResult result = adapter.put(ref, OperationKind.CREATE, payload("name", "Toaster"));

        Rejected rejected = assertInstanceOf(Rejected.class, result);
        assertEquals(WriteErrorCode.DUPLICATE_KEY, rejected.errorCode());
        assertEquals(Optional.of(original), adapter.get(ref), "Rejected CREATE must not change the value");
    }

    @Test
    void update_MissingKey_Upserts() {
        EntityRef ref = ref("product", "p-2");
        Payload value = payload("name", "Mug");

        StoreResult result = adapter.put(ref, OperationKind.UPDATE, value);

        assertTrue(result.isSuccessful());
        assertEquals(Optional.of(value), adapter.get(ref));
    }

    @Test
    void update_ExistingKey_ReplacesValue() {
        EntityRef ref = ref("product", "p-3");
        adapter.put(ref, OperationKind.CREATE, payload("name", "Mug", "stock", 1));

        adapter.put(ref, OperationKind.UPDATE, payload("name", "Mug", "stock", 5));

        assertEquals(5, ((Number) adapter.get(ref).orElseThrow().get("stock")).intValue());
    }

    @Test
    void delete_ExistingKey_RemovesValue() {
        EntityRef ref = ref("cart", "u123");
        adapter.put(ref, OperationKind.CREATE, payload("items", List.of()));

        StoreResult result = adapter.delete(ref);

        assertTrue(result.isSuccessful());
        assertTrue(adapter.get(ref).isEmpty());
    }

    @Test
    void delete_MissingKey_ReturnsNotFound() {
        StoreResult result = adapter.delete(ref("cart", "missing"));

        assertInstanceOf(NotFound.class, result);
        assertTrue(result.isSuccessful(), "Deleting a missing key is an idempotent success");
    }

    @Test
    void get_MissingKey_ReturnsEmpty() {
        assertTrue(adapter.get(ref("cart", "nobody")).isEmpty());
    }

    @Test
    void scanKeys_PagesInAscendingOrderUntilExhausted() {
        for (String key : List.of("k3", "k1", "k5", "k2", "k4")) {
            adapter.put(ref("order", key), OperationKind.CREATE, payload("key", key));
        }
        EntityType order = EntityType.of("order");

        List<String> seen = new ArrayList<>();
        EntityKey after = null;
        KeyPage page;
        int pages = 0;
        do {
            page = adapter.scanKeys(order, after, 2);
            page.keys().forEach(key -> seen.add(key.getValue()));
            after = page.lastKey();
            pages++;
        } while (page.hasMore());

        assertEquals(List.of("k1", "k2", "k3", "k4", "k5"), seen);
        assertEquals(3, pages);
    }

    @Test
    void scanKeys_OnlyReturnsRequestedEntityType() {
        adapter.put(ref("order", "o-1"), OperationKind.CREATE, payload("a", 1));
        adapter.put(ref("cart", "c-1"), OperationKind.CREATE, payload("a", 1));

        KeyPage page = adapter.scanKeys(EntityType.of("order"), null, 10);

        assertEquals(List.of(EntityKey.of("o-1")), page.keys());
        assertFalse(page.hasMore());
    }

    @Test
    void scanKeys_UnknownEntityType_ReturnsEmptyPage() {
        KeyPage page = adapter.scanKeys(EntityType.of("unknown"), null, 10);

        assertTrue(page.keys().isEmpty());
        assertFalse(page.hasMore());
    }
}
