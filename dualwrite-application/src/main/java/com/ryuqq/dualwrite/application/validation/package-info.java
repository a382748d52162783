/**
 * Validator API exposed to operational tooling.
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.application.validation;
