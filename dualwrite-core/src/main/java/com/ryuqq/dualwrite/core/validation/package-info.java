/**
 * Sync validation model: parity declarations, diff records, summaries and paging cursors.
 *
 * <p>Diffs are data, not failures. Nothing in this package is ever persisted as
 * authoritative state.</p>
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.core.validation;
