package com.ryuqq.dualwrite.testkit;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Operation;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory helpers for operations and payloads used across test suites.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * Operation op = OperationFixtures.create("cart", "u123", "items", List.of());
 * Payload payload = OperationFixtures.payload("name", "Kettle", "price", 19.99);
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class OperationFixtures {

    private OperationFixtures() {
    }

    public static EntityRef ref(String entityType, String entityKey) {
        return EntityRef.of(entityType, entityKey);
    }

    /**
     * Builds a payload from alternating field names and values.
     *
     * @param fieldsAndValues name1, value1, name2, value2, ...
     * @return payload preserving the given field order
     * @throws IllegalArgumentException if the argument count is odd or a name is not a string
     */
    public static Payload payload(Object... fieldsAndValues) {
        if (fieldsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("fieldsAndValues must be name/value pairs (current length: "
                + fieldsAndValues.length + ")");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            if (!(fieldsAndValues[i] instanceof String name)) {
                throw new IllegalArgumentException("field name must be a String (index: " + i + ")");
            }
            fields.put(name, fieldsAndValues[i + 1]);
        }
        return Payload.of(fields);
    }

    public static Operation create(String entityType, String entityKey, Object... fieldsAndValues) {
        return Operation.create(ref(entityType, entityKey), payload(fieldsAndValues));
    }

    public static Operation update(String entityType, String entityKey, Object... fieldsAndValues) {
        return Operation.update(ref(entityType, entityKey), payload(fieldsAndValues));
    }

    public static Operation delete(String entityType, String entityKey) {
        return Operation.delete(ref(entityType, entityKey));
    }

    /**
     * Builds an operation with an explicit submission time.
     */
    public static Operation operationAt(OperationKind kind, EntityRef ref, Payload payload, long submittedAt) {
        return new Operation(OperationId.generate(), ref, kind, payload, submittedAt);
    }
}
