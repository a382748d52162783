package com.ryuqq.dualwrite.core.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DualWriteConfigLoader 환경 변수 해석 테스트.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class DualWriteConfigLoaderTest {

    @Test
    void emptyEnvironment_UsesDefaults() {
        DualWriteConfig config = DualWriteConfigLoader.fromEnvironment(Map.of(), null);

        assertEquals(new DualWriteConfig(), config);
    }

    @Test
    void globalVariables_AreApplied() {
        Map<String, String> env = Map.of(
            "DUAL_WRITE_TO_LEGACY", "false",
            "DUAL_WRITE_BATCH_SIZE", "250",
            "DUAL_WRITE_SYNC_INTERVAL", "60",
            "DUAL_WRITE_RETRY_MAX_ATTEMPTS", "3",
            "DUAL_WRITE_RETRY_JITTER", "0"
        );

        DualWriteConfig config = DualWriteConfigLoader.fromEnvironment(env, null);

        assertFalse(config.writeToLegacy());
        assertEquals(250, config.batchSize());
        assertEquals(60, config.syncIntervalSeconds());
        assertEquals(3, config.retry().maxAttempts());
        assertEquals(0.0, config.retry().jitterFactor());
    }

    @Test
    void servicePrefix_OverridesGlobalVariable() {
        Map<String, String> env = Map.of(
            "DUAL_WRITE_BATCH_SIZE", "250",
            "CART_DUAL_WRITE_BATCH_SIZE", "50"
        );

        assertEquals(50, DualWriteConfigLoader.fromEnvironment(env, "cart").batchSize());
        assertEquals(250, DualWriteConfigLoader.fromEnvironment(env, "product").batchSize());
    }

    @Test
    void booleanAliases_AreAccepted() {
        Map<String, String> env = Map.of(
            "DUAL_WRITE_ASYNC_LEGACY", "off",
            "DUAL_WRITE_LOG_ALL", "YES",
            "DUAL_WRITE_FAIL_ON_LEGACY_ERROR", " 1 "
        );

        DualWriteConfig config = DualWriteConfigLoader.fromEnvironment(env, null);

        assertFalse(config.asyncLegacy());
        assertTrue(config.logAllOperations());
        assertTrue(config.failOnLegacyError());
    }

    @Test
    void invalidBoolean_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DualWriteConfigLoader.fromEnvironment(Map.of("DUAL_WRITE_TO_NEW", "maybe"), null)
        );
        assertTrue(exception.getMessage().contains("DUAL_WRITE_TO_NEW must be a boolean"));
    }

    @Test
    void invalidInteger_NamesScopedVariable() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DualWriteConfigLoader.fromEnvironment(Map.of("CART_DUAL_WRITE_BATCH_SIZE", "lots"), "cart")
        );
        assertTrue(exception.getMessage().contains("CART_DUAL_WRITE_BATCH_SIZE"));
    }

    @Test
    void noTargetStore_ThrowsException() {
        Map<String, String> env = Map.of(
            "DUAL_WRITE_TO_NEW", "false",
            "DUAL_WRITE_TO_LEGACY", "false"
        );

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DualWriteConfigLoader.fromEnvironment(env, null)
        );
        assertTrue(exception.getMessage().startsWith("Invalid dual-write configuration"));
    }

    @Test
    void invalidRetryPolicy_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DualWriteConfigLoader.fromEnvironment(Map.of("DUAL_WRITE_RETRY_MAX_ATTEMPTS", "0"), null)
        );
        assertTrue(exception.getMessage().startsWith("Invalid retry configuration"));
    }

    @Test
    void failOnNewErrorFalse_LoadsWithWarning() {
        DualWriteConfig config = DualWriteConfigLoader.fromEnvironment(
            Map.of("DUAL_WRITE_FAIL_ON_NEW_ERROR", "false"), null);

        assertFalse(config.failOnNewError());
    }
}
