/**
 * Retry queue port for secondary writes.
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.application.retry;
