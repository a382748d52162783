/**
 * File-backed retry task persistence using Jackson.
 *
 * <p>Closes the durability gap of the in-memory retry store: pending secondary
 * writes survive a process restart and resume draining where they left off.</p>
 *
 * @see com.ryuqq.dualwrite.core.spi.RetryTaskStore
 * @author Dual-Write Team
 * @since 1.0.0
 */
package com.ryuqq.dualwrite.adapter.jsonfile;
