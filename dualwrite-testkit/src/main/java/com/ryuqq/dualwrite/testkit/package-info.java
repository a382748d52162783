/**
 * Test fixtures shared by adapter and engine test suites.
 *
 * <p>Contract suites live in {@link com.ryuqq.dualwrite.testkit.contract}.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
package com.ryuqq.dualwrite.testkit;
