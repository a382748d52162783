/**
 * Write outcome types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dualwrite.core.outcome.StoreResult} - what a store adapter call returned</li>
 *   <li>{@link com.ryuqq.dualwrite.core.outcome.WriteOutcome} - one recorded attempt against one store</li>
 *   <li>{@link com.ryuqq.dualwrite.core.outcome.DualWriteResult} - what the coordinator returns to the caller</li>
 * </ul>
 *
 * <p>Failures are values. A failed secondary write is an ordinary branch, not an exception
 * threaded through the retry logic.</p>
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.core.outcome;
