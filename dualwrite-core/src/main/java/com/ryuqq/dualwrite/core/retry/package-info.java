/**
 * Retry task model for secondary writes that have not yet been applied.
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.core.retry;
