package com.ryuqq.dualwrite.application.validation;

import com.ryuqq.dualwrite.core.model.EntityKey;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.validation.DiffRecord;
import com.ryuqq.dualwrite.core.validation.DiffSummary;
import com.ryuqq.dualwrite.core.validation.PageCursor;
import com.ryuqq.dualwrite.core.validation.ValidationPage;

import java.util.List;

/**
 * 두 스토어 간 엔티티 상태를 비교하는 검증기 (운영 도구용 API).
 *
 * <p>검증은 두 스토어에 대해 읽기 전용입니다. 쓰기는 {@link #reconcile}에
 * {@code allowRepair=true}를 명시적으로 전달한 경우에만 발생합니다.</p>
 *
 * <p><strong>전체 검증 패스:</strong></p>
 * <pre>
 * PageCursor cursor = PageCursor.start();
 * do {
 *     ValidationPage page = validator.validateBatch(type, cursor, 100);
 *     report(page.diffs());
 *     cursor = page.nextCursor();
 * } while (cursor != null);
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public interface SyncValidator {

    /**
     * 단일 키 비교.
     *
     * @param entityType 엔티티 종류 (패리티 필드가 등록되어 있어야 함)
     * @param entityKey 엔티티 키
     * @return 비교 보고
     * @throws IllegalArgumentException 인자가 null이거나 등록되지 않은 엔티티 종류인 경우
     * @throws com.ryuqq.dualwrite.core.validation.StoreReadException 스토어 읽기 실패 시
     */
    DiffRecord validateOne(EntityType entityType, EntityKey entityKey);

    /**
     * 한 페이지 검증.
     *
     * <p>PRIMARY 단계는 primary 키를 읽어 secondary와 비교하고, SECONDARY 단계는
     * secondary 키 중 primary에 없는 키만 보고합니다. 모든 페이지를 이어 붙이면
     * {@link #validateAll}과 같은 결과가 됩니다 (스캔 중 동시 쓰기가 없을 때).</p>
     *
     * @param entityType 엔티티 종류
     * @param cursor 재개 위치 (null이면 처음부터)
     * @param pageSize 페이지 크기 (양수)
     * @return 페이지 결과와 다음 커서
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     * @throws com.ryuqq.dualwrite.core.validation.StoreReadException 스토어 읽기 실패 시
     */
    ValidationPage validateBatch(EntityType entityType, PageCursor cursor, int pageSize);

    /**
     * 페이지 없이 전체 검증.
     *
     * @param entityType 엔티티 종류
     * @return 전체 비교 보고
     */
    List<DiffRecord> validateAll(EntityType entityType);

    /**
     * 비교 보고 요약.
     *
     * @param diffs 비교 보고 목록
     * @return 요약
     */
    DiffSummary summarize(List<DiffRecord> diffs);

    /**
     * 불일치 재조정.
     *
     * <p>MISSING_IN_SECONDARY 또는 VALUE_MISMATCH에 대해 primary의 현재 값을
     * secondary에만 다시 기록합니다. 실행 중인 쓰기와 경합하지 않도록
     * 일반 쓰기와 같은 키 단위 직렬화를 거칩니다.</p>
     *
     * @param diff 비교 보고
     * @param allowRepair 명시적 승인 플래그
     * @return 재조정 결과
     * @throws IllegalStateException allowRepair가 false인 경우
     */
    RepairResult reconcile(DiffRecord diff, boolean allowRepair);
}
