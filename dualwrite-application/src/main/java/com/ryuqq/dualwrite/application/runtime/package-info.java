/**
 * Background runtime abstraction for the retry drain and the validation sweep.
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.application.runtime;
