/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces implemented by infrastructure adapters.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dualwrite.core.spi.StoreAdapter} - I/O against one database (new or legacy)</li>
 *   <li>{@link com.ryuqq.dualwrite.core.spi.WriteLedger} - Append-only operation history</li>
 *   <li>{@link com.ryuqq.dualwrite.core.spi.RetryTaskStore} - Pending secondary retries</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (dualwrite-adapter-inmemory, dualwrite-adapter-jsonfile, or a service's
 * own JDBC adapters) provide the concrete implementations. Contract tests for each SPI
 * live in dualwrite-testkit.</p>
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.core.spi;
