/**
 * Engine configuration.
 *
 * <p>{@link com.ryuqq.dualwrite.core.config.DualWriteConfig} is built once per process, usually by
 * {@link com.ryuqq.dualwrite.core.config.DualWriteConfigLoader} from environment variables, and
 * passed explicitly to the coordinator, the retry queue and the validator.</p>
 *
 * @since 1.0.0
 * @author Dual-Write Team
 */
package com.ryuqq.dualwrite.core.config;
