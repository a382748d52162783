/**
 * In-memory store adapter implementation package.
 *
 * <p>Provides a reference implementation of the
 * {@link com.ryuqq.dualwrite.core.spi.StoreAdapter} SPI for tests and local runs.
 * Two instances stand in for the new store and the legacy store.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for contract tests and engine scenario tests</li>
 * </ul>
 *
 * @see com.ryuqq.dualwrite.core.spi.StoreAdapter
 * @author Dual-Write Team
 * @since 1.0.0
 */
package com.ryuqq.dualwrite.adapter.inmemory.store;
