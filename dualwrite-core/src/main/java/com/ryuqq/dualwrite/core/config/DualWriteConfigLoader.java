package com.ryuqq.dualwrite.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * 환경 변수로부터 {@link DualWriteConfig}를 적재.
 *
 * <p>서비스 접두사가 주어지면 {@code {PREFIX}_DUAL_WRITE_*}를 먼저 찾고,
 * 없으면 접두사 없는 {@code DUAL_WRITE_*}를 사용합니다.</p>
 *
 * <p><strong>환경 변수:</strong></p>
 * <pre>
 * DUAL_WRITE_ENABLED              (boolean, 기본 true)
 * DUAL_WRITE_TO_NEW               (boolean, 기본 true)
 * DUAL_WRITE_TO_LEGACY            (boolean, 기본 true)
 * DUAL_WRITE_FAIL_ON_NEW_ERROR    (boolean, 기본 true, false는 무시됨)
 * DUAL_WRITE_FAIL_ON_LEGACY_ERROR (boolean, 기본 false)
 * DUAL_WRITE_ASYNC_LEGACY         (boolean, 기본 true)
 * DUAL_WRITE_VALIDATE_SYNC        (boolean, 기본 true)
 * DUAL_WRITE_SYNC_INTERVAL        (초, 기본 300)
 * DUAL_WRITE_BATCH_SIZE           (기본 100)
 * DUAL_WRITE_STORE_TIMEOUT_MS     (기본 5000)
 * DUAL_WRITE_LOG_ALL              (boolean, 기본 false)
 * DUAL_WRITE_RETRY_MAX_ATTEMPTS   (기본 5)
 * DUAL_WRITE_RETRY_BASE_DELAY_MS  (기본 1000)
 * DUAL_WRITE_RETRY_MAX_DELAY_MS   (기본 300000)
 * DUAL_WRITE_RETRY_JITTER         (기본 0.1)
 * </pre>
 *
 * <p><strong>오류 처리:</strong> 해석할 수 없는 값과 유효하지 않은 조합은
 * 변수명을 포함한 {@link IllegalArgumentException}으로 적재 시점에 거부됩니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class DualWriteConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(DualWriteConfigLoader.class);

    static final String ENABLED = "DUAL_WRITE_ENABLED";
    static final String TO_NEW = "DUAL_WRITE_TO_NEW";
    static final String TO_LEGACY = "DUAL_WRITE_TO_LEGACY";
    static final String FAIL_ON_NEW_ERROR = "DUAL_WRITE_FAIL_ON_NEW_ERROR";
    static final String FAIL_ON_LEGACY_ERROR = "DUAL_WRITE_FAIL_ON_LEGACY_ERROR";
    static final String ASYNC_LEGACY = "DUAL_WRITE_ASYNC_LEGACY";
    static final String VALIDATE_SYNC = "DUAL_WRITE_VALIDATE_SYNC";
    static final String SYNC_INTERVAL = "DUAL_WRITE_SYNC_INTERVAL";
    static final String BATCH_SIZE = "DUAL_WRITE_BATCH_SIZE";
    static final String STORE_TIMEOUT_MS = "DUAL_WRITE_STORE_TIMEOUT_MS";
    static final String LOG_ALL = "DUAL_WRITE_LOG_ALL";
    static final String RETRY_MAX_ATTEMPTS = "DUAL_WRITE_RETRY_MAX_ATTEMPTS";
    static final String RETRY_BASE_DELAY_MS = "DUAL_WRITE_RETRY_BASE_DELAY_MS";
    static final String RETRY_MAX_DELAY_MS = "DUAL_WRITE_RETRY_MAX_DELAY_MS";
    static final String RETRY_JITTER = "DUAL_WRITE_RETRY_JITTER";

    private final Map<String, String> env;
    private final String prefix;

    private DualWriteConfigLoader(Map<String, String> env, String servicePrefix) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        this.env = env;
        this.prefix = (servicePrefix == null || servicePrefix.isBlank())
            ? null
            : servicePrefix.trim().toUpperCase(Locale.ROOT) + "_";
    }

    /**
     * 프로세스 환경 변수로부터 적재.
     *
     * @param servicePrefix 서비스 접두사 (null 가능, 예: "cart")
     * @return 검증된 설정
     * @throws IllegalArgumentException 값 또는 조합이 유효하지 않은 경우
     */
    public static DualWriteConfig fromEnvironment(String servicePrefix) {
        return fromEnvironment(System.getenv(), servicePrefix);
    }

    /**
     * 주어진 변수 맵으로부터 적재.
     *
     * @param env 변수 맵
     * @param servicePrefix 서비스 접두사 (null 가능)
     * @return 검증된 설정
     * @throws IllegalArgumentException 값 또는 조합이 유효하지 않은 경우
     */
    public static DualWriteConfig fromEnvironment(Map<String, String> env, String servicePrefix) {
        return new DualWriteConfigLoader(env, servicePrefix).load();
    }

    private DualWriteConfig load() {
        DualWriteConfig defaults = new DualWriteConfig();
        RetryPolicy retryDefaults = defaults.retry();

        boolean failOnNewError = bool(FAIL_ON_NEW_ERROR, defaults.failOnNewError());
        if (!failOnNewError) {
            log.warn("{}=false is ignored: primary write failures are always fatal", FAIL_ON_NEW_ERROR);
        }

        RetryPolicy retry;
        try {
            retry = new RetryPolicy(
                integer(RETRY_MAX_ATTEMPTS, retryDefaults.maxAttempts()),
                longValue(RETRY_BASE_DELAY_MS, retryDefaults.baseDelayMs()),
                longValue(RETRY_MAX_DELAY_MS, retryDefaults.maxDelayMs()),
                decimal(RETRY_JITTER, retryDefaults.jitterFactor())
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid retry configuration: " + e.getMessage(), e);
        }

        DualWriteConfig config;
        try {
            config = new DualWriteConfig(
                bool(ENABLED, defaults.enabled()),
                bool(TO_NEW, defaults.writeToNew()),
                bool(TO_LEGACY, defaults.writeToLegacy()),
                failOnNewError,
                bool(FAIL_ON_LEGACY_ERROR, defaults.failOnLegacyError()),
                bool(ASYNC_LEGACY, defaults.asyncLegacy()),
                bool(VALIDATE_SYNC, defaults.validateSync()),
                longValue(SYNC_INTERVAL, defaults.syncIntervalSeconds()),
                integer(BATCH_SIZE, defaults.batchSize()),
                longValue(STORE_TIMEOUT_MS, defaults.storeTimeoutMs()),
                bool(LOG_ALL, defaults.logAllOperations()),
                retry
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid dual-write configuration: " + e.getMessage(), e);
        }

        log.info("Dual-write configuration loaded: writeToNew={}, writeToLegacy={}, enabled={}, asyncLegacy={}, "
                + "failOnLegacyError={}, validateSync={}, retry={}",
            config.writeToNew(), config.writeToLegacy(), config.enabled(), config.asyncLegacy(),
            config.failOnLegacyError(), config.validateSync(), config.retry());
        return config;
    }

    private String lookup(String name) {
        if (prefix != null) {
            String scoped = env.get(prefix + name);
            if (scoped != null) {
                return scoped.trim();
            }
        }
        String value = env.get(name);
        return value == null ? null : value.trim();
    }

    private String describe(String name) {
        return prefix == null ? name : prefix + name + " (or " + name + ")";
    }

    private boolean bool(String name, boolean defaultValue) {
        String raw = lookup(name);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
            case "on":
                return true;
            case "false":
            case "0":
            case "no":
            case "off":
                return false;
            default:
                throw new IllegalArgumentException(
                    describe(name) + " must be a boolean (current: " + raw + ")"
                );
        }
    }

    private int integer(String name, int defaultValue) {
        String raw = lookup(name);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(describe(name) + " must be an integer (current: " + raw + ")", e);
        }
    }

    private long longValue(String name, long defaultValue) {
        String raw = lookup(name);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(describe(name) + " must be an integer (current: " + raw + ")", e);
        }
    }

    private double decimal(String name, double defaultValue) {
        String raw = lookup(name);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(describe(name) + " must be a number (current: " + raw + ")", e);
        }
    }
}
