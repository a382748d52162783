/**
 * Status surface exposed to health-check collaborators.
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.application.status;
