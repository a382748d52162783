/**
 * In-memory write ledger.
 *
 * @see com.ryuqq.dualwrite.core.spi.WriteLedger
 * @author Dual-Write Team
 * @since 1.0.0
 */
package com.ryuqq.dualwrite.adapter.inmemory.ledger;
