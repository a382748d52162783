package com.ryuqq.dualwrite.adapter.inmemory.store;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryStoreAdapter 테스트 보조 기능 테스트.
 */
class InMemoryStoreAdapterTest {

    private InMemoryStoreAdapter adapter;
    private final EntityRef ref = EntityRef.of("product", "p-1");

    @BeforeEach
    void setUp() {
        adapter = new InMemoryStoreAdapter("legacy");
    }

    @Test
    void constructor_BlankName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryStoreAdapter(" "));
    }

    @Test
    void put_Delete_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> adapter.put(ref, OperationKind.DELETE, Payload.empty()));
    }

    @Test
    void mutations_RecordsAppliedWritesOnly() {
        Payload value = Payload.builder().put("name", "Kettle").build();
        adapter.put(ref, OperationKind.CREATE, value);
        adapter.put(ref, OperationKind.CREATE, value);
        adapter.delete(ref);
        adapter.delete(ref);

        assertEquals(2, adapter.mutations().size(), "Rejected CREATE and NotFound DELETE are not mutations");
        assertEquals(OperationKind.CREATE, adapter.mutationsOf(ref).get(0).kind());
        assertEquals(OperationKind.DELETE, adapter.mutationsOf(ref).get(1).kind());
    }

    @Test
    void seed_DoesNotRecordMutation() {
        adapter.seed(ref, Payload.builder().put("name", "Drifted").build());

        assertTrue(adapter.mutations().isEmpty());
        assertEquals(1, adapter.count(EntityType.of("product")));
        assertEquals("Drifted", adapter.get(ref).orElseThrow().get("name"));
    }

    @Test
    void clear_RemovesDataAndHistory() {
        adapter.put(ref, OperationKind.UPDATE, Payload.empty());

        adapter.clear();

        assertTrue(adapter.get(ref).isEmpty());
        assertTrue(adapter.mutations().isEmpty());
        assertEquals(0, adapter.count(EntityType.of("product")));
    }
}
