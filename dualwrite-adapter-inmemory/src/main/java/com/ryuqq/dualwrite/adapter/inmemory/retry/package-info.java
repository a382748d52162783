/**
 * In-memory retry task store.
 *
 * @see com.ryuqq.dualwrite.core.spi.RetryTaskStore
 * @author Dual-Write Team
 * @since 1.0.0
 */
package com.ryuqq.dualwrite.adapter.inmemory.retry;
