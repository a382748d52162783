package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.application.runtime.Runtime;
import com.ryuqq.dualwrite.application.validation.SyncValidator;
import com.ryuqq.dualwrite.core.config.DualWriteConfig;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.validation.DiffSummary;
import com.ryuqq.dualwrite.core.validation.PageCursor;
import com.ryuqq.dualwrite.core.validation.ParityFieldRegistry;
import com.ryuqq.dualwrite.core.validation.ValidationPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 주기적 전체 검증 패스.
 *
 * <p>{@link #pump()} 한 번에 등록된 모든 엔티티 타입을 {@link SyncValidator#validateBatch}로
 * 페이지 단위(batchSize) 검증하고, 결과를 메트릭과 로그로 남깁니다. 페이지마다 요약만 누적하므로
 * 테이블 크기와 관계없이 메모리 사용량은 한 페이지 분량입니다.
 * 불일치는 예외가 아니라 데이터로 보고됩니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>validateSync=false이면 아무것도 하지 않음</li>
 *   <li>타입별 요약은 {@link #lastSummaries()}로 조회</li>
 *   <li>스토어 읽기 실패는 ERROR 로그 + 검증 오류 카운트 후 다음 타입으로 진행</li>
 *   <li>모든 타입이 끝까지 검증된 경우에만 완료 시각과 불일치 수를 기록</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class ValidationSweep implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(ValidationSweep.class);

    private final SyncValidator validator;
    private final ParityFieldRegistry registry;
    private final DualWriteConfig config;
    private final DualWriteMetrics metrics;
    private final Clock clock;
    private final Map<EntityType, DiffSummary> lastSummaries = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ValidationSweep(SyncValidator validator,
                           ParityFieldRegistry registry,
                           DualWriteConfig config,
                           DualWriteMetrics metrics,
                           Clock clock) {
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.validator = validator;
        this.registry = registry;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void pump() {
        if (!config.validateSync()) {
            log.debug("Sync validation disabled, skipping sweep");
            return;
        }

        long mismatches = 0;
        int failedTypes = 0;
        for (EntityType entityType : registry.registeredTypes()) {
            try {
                DiffSummary summary = sweepType(entityType);
                lastSummaries.put(entityType, summary);
                mismatches += summary.mismatches();
                logSummary(entityType, summary);
            } catch (Exception e) {
                failedTypes++;
                metrics.recordValidationError();
                log.error("Validation of {} aborted", entityType.getValue(), e);
            }
        }

        if (failedTypes == 0) {
            metrics.recordValidationPass(clock.millis(), mismatches);
        }
    }

    private DiffSummary sweepType(EntityType entityType) {
        DiffSummary summary = DiffSummary.empty();
        PageCursor cursor = PageCursor.start();
        while (cursor != null) {
            ValidationPage page = validator.validateBatch(entityType, cursor, config.batchSize());
            summary = summary.plus(validator.summarize(page.diffs()));
            cursor = page.nextCursor();
        }
        return summary;
    }

    private void logSummary(EntityType entityType, DiffSummary summary) {
        if (summary.mismatches() == 0) {
            log.info("Validation of {}: {} entities in sync", entityType.getValue(), summary.total());
            return;
        }
        log.warn("Validation of {}: {}/{} mismatched ({}% in sync) {}, common issues: {}",
            entityType.getValue(), summary.mismatches(), summary.total(),
            String.format("%.2f", summary.syncPercentage()),
            summary.mismatchesByClassification(), summary.commonIssues());
    }

    /**
     * @return 엔티티 타입별 마지막 검증 요약
     */
    public Map<EntityType, DiffSummary> lastSummaries() {
        return Collections.unmodifiableMap(lastSummaries);
    }
}
