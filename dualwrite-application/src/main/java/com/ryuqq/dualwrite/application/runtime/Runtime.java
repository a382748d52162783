package com.ryuqq.dualwrite.application.runtime;

/**
 * Schedulable background cycle.
 *
 * <p>The retry queue drain and the periodic validation sweep are both runtimes.
 * They communicate with the coordinator only through the store adapters and the
 * ledger, never through shared timers.</p>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is invoked repeatedly by a scheduler ({@code PeriodicRuntimeScheduler},
 *       {@literal @Scheduled}, or a plain loop)</li>
 *   <li>Each call performs one bounded cycle and returns</li>
 *   <li>Per-item failures are logged and skipped; a cycle never stops on one bad item</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * {@literal @Scheduled}(fixedDelay = 500)
 * public void drainRetries() {
 *     retryRuntime.pump();
 * }
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single cycle.
     *
     * @throws RuntimeException if critical infrastructure is unavailable
     */
    void pump();
}
