package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.adapter.runner.KeyedLeaseManager.Lease;
import com.ryuqq.dualwrite.application.validation.RepairResult;
import com.ryuqq.dualwrite.application.validation.SyncValidator;
import com.ryuqq.dualwrite.core.model.EntityKey;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.outcome.StoreRole;
import com.ryuqq.dualwrite.core.spi.KeyPage;
import com.ryuqq.dualwrite.core.spi.StoreAdapter;
import com.ryuqq.dualwrite.core.validation.DiffClassification;
import com.ryuqq.dualwrite.core.validation.DiffRecord;
import com.ryuqq.dualwrite.core.validation.DiffSummary;
import com.ryuqq.dualwrite.core.validation.EntityParitySpec;
import com.ryuqq.dualwrite.core.validation.FieldDifference;
import com.ryuqq.dualwrite.core.validation.PageCursor;
import com.ryuqq.dualwrite.core.validation.ParityFieldRegistry;
import com.ryuqq.dualwrite.core.validation.ScanPhase;
import com.ryuqq.dualwrite.core.validation.ValidationPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 두 스토어를 직접 읽어 비교하는 Sync Validator 구현체.
 *
 * <p>스토어 어댑터에 대해 읽기 전용이며, 작업/outcome/재시도 상태를 변경하지 않습니다.
 * 복구({@link #reconcile})만 {@link SecondaryRepairer}를 통해 secondary에 씁니다.</p>
 *
 * <p><strong>페이지 검증 (2단계 스캔):</strong></p>
 * <pre>
 * PRIMARY 단계:   primary 키를 순서대로 페이지 → 각 키를 secondary와 비교 (모든 분류 보고)
 *   ↓ (primary 키 소진)
 * SECONDARY 단계: secondary 키를 순서대로 페이지 → primary에 없는 키만 MISSING_IN_PRIMARY로 보고
 *   ↓ (secondary 키 소진)
 * nextCursor = null
 * </pre>
 *
 * <p>커서는 마지막으로 처리한 키만 담으므로, 같은 커서로 다시 호출하면 같은 페이지를 재시도합니다.</p>
 *
 * <p><strong>Lease 범위:</strong> 한 키 비교 동안(두 번의 읽기)만 해당 키의 lease를 보유합니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class StoreSyncValidator implements SyncValidator {

    private static final Logger log = LoggerFactory.getLogger(StoreSyncValidator.class);

    private final StoreAdapter primaryStore;
    private final StoreAdapter secondaryStore;
    private final ParityFieldRegistry registry;
    private final KeyedLeaseManager leaseManager;
    private final StoreInvoker storeInvoker;
    private final PayloadComparator comparator;
    private final SecondaryRepairer repairer;
    private final int defaultPageSize;

    /**
     * 생성자.
     *
     * @param primaryStore 신규 스토어 어댑터
     * @param secondaryStore 레거시 스토어 어댑터
     * @param registry 엔티티 타입별 패리티 필드
     * @param leaseManager 키 단위 직렬화기 (Coordinator와 공유)
     * @param storeInvoker 타임아웃 적용 호출기
     * @param comparator payload 비교기
     * @param repairer secondary 복구기
     * @param defaultPageSize {@link #validateAll} 페이지 크기
     * @throws IllegalArgumentException 의존성이 null이거나 페이지 크기가 양수가 아닌 경우
     */
    public StoreSyncValidator(StoreAdapter primaryStore,
                              StoreAdapter secondaryStore,
                              ParityFieldRegistry registry,
                              KeyedLeaseManager leaseManager,
                              StoreInvoker storeInvoker,
                              PayloadComparator comparator,
                              SecondaryRepairer repairer,
                              int defaultPageSize) {
        if (primaryStore == null) {
            throw new IllegalArgumentException("primaryStore cannot be null");
        }
        if (secondaryStore == null) {
            throw new IllegalArgumentException("secondaryStore cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (leaseManager == null) {
            throw new IllegalArgumentException("leaseManager cannot be null");
        }
        if (storeInvoker == null) {
            throw new IllegalArgumentException("storeInvoker cannot be null");
        }
        if (comparator == null) {
            throw new IllegalArgumentException("comparator cannot be null");
        }
        if (repairer == null) {
            throw new IllegalArgumentException("repairer cannot be null");
        }
        if (defaultPageSize <= 0) {
            throw new IllegalArgumentException("defaultPageSize must be positive (current: " + defaultPageSize + ")");
        }
        this.primaryStore = primaryStore;
        this.secondaryStore = secondaryStore;
        this.registry = registry;
        this.leaseManager = leaseManager;
        this.storeInvoker = storeInvoker;
        this.comparator = comparator;
        this.repairer = repairer;
        this.defaultPageSize = defaultPageSize;
    }

    @Override
    public DiffRecord validateOne(EntityType entityType, EntityKey entityKey) {
        if (entityKey == null) {
            throw new IllegalArgumentException("entityKey cannot be null");
        }
        EntityParitySpec spec = requireSpec(entityType);
        return compareKey(spec, new EntityRef(entityType, entityKey));
    }

    @Override
    public ValidationPage validateBatch(EntityType entityType, PageCursor cursor, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive (current: " + pageSize + ")");
        }
        EntityParitySpec spec = requireSpec(entityType);
        PageCursor position = cursor == null ? PageCursor.start() : cursor;

        if (position.phase() == ScanPhase.PRIMARY) {
            KeyPage page = storeInvoker.scan(primaryStore, StoreRole.PRIMARY, entityType, position.afterKey(), pageSize);
            List<DiffRecord> diffs = new ArrayList<>(page.keys().size());
            for (EntityKey key : page.keys()) {
                diffs.add(compareKey(spec, new EntityRef(entityType, key)));
            }
            PageCursor next = page.hasMore()
                ? new PageCursor(ScanPhase.PRIMARY, page.lastKey())
                : new PageCursor(ScanPhase.SECONDARY, null);
            return new ValidationPage(diffs, next);
        }

        // SECONDARY 단계: primary 스캔으로는 찾을 수 없는 키만 보고
        KeyPage page = storeInvoker.scan(secondaryStore, StoreRole.SECONDARY, entityType, position.afterKey(), pageSize);
        List<DiffRecord> diffs = new ArrayList<>();
        for (EntityKey key : page.keys()) {
            DiffRecord diff = compareKey(spec, new EntityRef(entityType, key));
            if (diff.classification() == DiffClassification.MISSING_IN_PRIMARY) {
                diffs.add(diff);
            }
        }
        PageCursor next = page.hasMore() ? new PageCursor(ScanPhase.SECONDARY, page.lastKey()) : null;
        return new ValidationPage(diffs, next);
    }

    @Override
    public List<DiffRecord> validateAll(EntityType entityType) {
        requireSpec(entityType);
        List<DiffRecord> diffs = new ArrayList<>();
        PageCursor cursor = PageCursor.start();
        while (cursor != null) {
            ValidationPage page = validateBatch(entityType, cursor, defaultPageSize);
            diffs.addAll(page.diffs());
            cursor = page.nextCursor();
        }
        log.debug("Validated {} entities of {}", diffs.size(), entityType.getValue());
        return diffs;
    }

    @Override
    public DiffSummary summarize(List<DiffRecord> diffs) {
        return DiffSummary.of(diffs);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException allowRepair가 false인 경우
     */
    @Override
    public RepairResult reconcile(DiffRecord diff, boolean allowRepair) {
        if (diff == null) {
            throw new IllegalArgumentException("diff cannot be null");
        }
        if (!allowRepair) {
            throw new IllegalStateException("Repair of " + diff.ref() + " requires allowRepair=true");
        }
        if (!diff.classification().isRepairable()) {
            return RepairResult.notApplicable(diff.ref());
        }
        return repairer.repair(diff.ref());
    }

    private EntityParitySpec requireSpec(EntityType entityType) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        return registry.require(entityType);
    }

    private DiffRecord compareKey(EntityParitySpec spec, EntityRef ref) {
        Optional<Payload> primary;
        Optional<Payload> secondary;
        try (Lease lease = leaseManager.acquire(ref)) {
            primary = storeInvoker.read(primaryStore, StoreRole.PRIMARY, ref);
            secondary = storeInvoker.read(secondaryStore, StoreRole.SECONDARY, ref);
        }

        if (primary.isEmpty() && secondary.isEmpty()) {
            return DiffRecord.match(ref, null, null);
        }
        if (primary.isEmpty()) {
            return DiffRecord.missingInPrimary(ref, secondary.get());
        }
        if (secondary.isEmpty()) {
            return DiffRecord.missingInSecondary(ref, primary.get());
        }
        List<FieldDifference> differences = comparator.compare(spec, primary.get(), secondary.get());
        return differences.isEmpty()
            ? DiffRecord.match(ref, primary.get(), secondary.get())
            : DiffRecord.mismatch(ref, primary.get(), secondary.get(), differences);
    }
}
