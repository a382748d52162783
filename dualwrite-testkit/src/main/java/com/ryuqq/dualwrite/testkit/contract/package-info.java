/**
 * Reusable contract suites for the engine's SPIs.
 *
 * <p>Each suite is an abstract JUnit class. An adapter module subclasses it in its own
 * test sources and supplies a fresh implementation through the factory method.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
package com.ryuqq.dualwrite.testkit.contract;
