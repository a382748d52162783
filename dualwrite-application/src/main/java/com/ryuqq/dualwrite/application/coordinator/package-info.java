/**
 * Coordinator API exposed to calling services.
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.application.coordinator;
