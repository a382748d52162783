package com.ryuqq.dualwrite.core.config;

/**
 * 이중 쓰기 엔진의 정책 설정 (불변 record).
 *
 * <p>프로세스 시작 시 한 번 생성되어 코디네이터, 재시도 큐, 검증기에 주입됩니다.
 * 런타임 재적재(hot-reload)는 지원하지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 이중 쓰기 마스터 스위치. false이면 신규 스토어에만 기록 (기본 true)</li>
 *   <li>writeToNew: primary(신규) 스토어 쓰기 (기본 true)</li>
 *   <li>writeToLegacy: secondary(레거시) 스토어 쓰기 (기본 true)</li>
 *   <li>failOnNewError: 항상 사실상 true. primary 실패는 언제나 치명적 (기본 true)</li>
 *   <li>failOnLegacyError: secondary 실패를 전체 실패로 승격 (기본 false)</li>
 *   <li>asyncLegacy: secondary 쓰기를 재시도 큐로 지연 (기본 true)</li>
 *   <li>validateSync: 주기적 동기화 검증 실행 (기본 true)</li>
 *   <li>syncIntervalSeconds: 주기적 검증 간격 (기본 300초)</li>
 *   <li>batchSize: 검증기 페이지 크기 (기본 100)</li>
 *   <li>storeTimeoutMs: 스토어 호출별 타임아웃 (기본 5000ms)</li>
 *   <li>logAllOperations: 모든 작업을 INFO로 기록 (기본 false, 실패만 기록)</li>
 *   <li>retry: secondary 재시도 정책</li>
 * </ul>
 *
 * <p><strong>유효하지 않은 조합:</strong> 쓰기 대상 스토어가 하나도 없는 설정은
 * 첫 쓰기 시점이 아닌 생성 시점에 거부됩니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record DualWriteConfig(
    boolean enabled,
    boolean writeToNew,
    boolean writeToLegacy,
    boolean failOnNewError,
    boolean failOnLegacyError,
    boolean asyncLegacy,
    boolean validateSync,
    long syncIntervalSeconds,
    int batchSize,
    long storeTimeoutMs,
    boolean logAllOperations,
    RetryPolicy retry
) {

    /**
     * 기본 설정 생성자.
     */
    public DualWriteConfig() {
        this(true, true, true, true, false, true, true, 300, 100, 5000, false, new RetryPolicy());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 또는 쓰기 대상이 없는 경우
     */
    public DualWriteConfig {
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (!writeToNew && !(enabled && writeToLegacy)) {
            throw new IllegalArgumentException(
                "At least one target store must be enabled (writeToNew=" + writeToNew
                    + ", writeToLegacy=" + writeToLegacy + ", enabled=" + enabled + ")"
            );
        }
        if (syncIntervalSeconds <= 0) {
            throw new IllegalArgumentException(
                "syncIntervalSeconds must be positive (current: " + syncIntervalSeconds + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (storeTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "storeTimeoutMs must be positive (current: " + storeTimeoutMs + ")"
            );
        }
    }

    /**
     * 레거시 쓰기를 끈 컷오버 설정 (신규 스토어 단독).
     *
     * @return 신규 스토어 전용 설정
     */
    public static DualWriteConfig newStoreOnly() {
        return new DualWriteConfig().withWriteToLegacy(false).withValidateSync(false);
    }

    /**
     * 신규 스토어 쓰기를 끈 롤백 설정 (레거시 스토어 단독).
     *
     * @return 레거시 스토어 전용 설정
     */
    public static DualWriteConfig legacyStoreOnly() {
        return new DualWriteConfig().withWriteToNew(false).withAsyncLegacy(false).withValidateSync(false);
    }

    /**
     * secondary 스토어 쓰기 여부.
     *
     * @return enabled이고 writeToLegacy이면 true
     */
    public boolean secondaryWritesEnabled() {
        return enabled && writeToLegacy;
    }

    /**
     * 레거시 단독 모드 여부 (primary 쓰기 없음).
     *
     * @return writeToNew가 false이면 true
     */
    public boolean legacyOnly() {
        return !writeToNew;
    }

    public long syncIntervalMs() {
        return syncIntervalSeconds * 1000L;
    }

    public DualWriteConfig withEnabled(boolean enabled) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withWriteToNew(boolean writeToNew) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withWriteToLegacy(boolean writeToLegacy) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withFailOnLegacyError(boolean failOnLegacyError) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withAsyncLegacy(boolean asyncLegacy) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withValidateSync(boolean validateSync) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withSyncIntervalSeconds(long syncIntervalSeconds) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withBatchSize(int batchSize) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withStoreTimeoutMs(long storeTimeoutMs) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withLogAllOperations(boolean logAllOperations) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }

    public DualWriteConfig withRetry(RetryPolicy retry) {
        return new DualWriteConfig(enabled, writeToNew, writeToLegacy, failOnNewError, failOnLegacyError,
            asyncLegacy, validateSync, syncIntervalSeconds, batchSize, storeTimeoutMs, logAllOperations, retry);
    }
}
