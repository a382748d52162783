/**
 * Core domain model package containing value objects and the write operation.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dualwrite.core.model.OperationId} - Operation unique identifier and idempotency key</li>
 *   <li>{@link com.ryuqq.dualwrite.core.model.EntityType} - Entity type (cart, product, user ...)</li>
 *   <li>{@link com.ryuqq.dualwrite.core.model.EntityKey} - Entity key within a type</li>
 *   <li>{@link com.ryuqq.dualwrite.core.model.Payload} - Opaque field map</li>
 * </ul>
 *
 * <h2>Composite Keys</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dualwrite.core.model.EntityRef} - (EntityType, EntityKey), the unit of serialization</li>
 * </ul>
 *
 * <h2>Operation</h2>
 * <p>{@link com.ryuqq.dualwrite.core.model.Operation} is the immutable unit of work handed to the
 * coordinator. Callers build it fully formed; the engine never decides what business data to write.</p>
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.core.model;
