package com.ryuqq.dualwrite.application.validation;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.outcome.WriteOutcome;

import java.util.Optional;

/**
 * 재조정 결과.
 *
 * @param ref 대상 엔티티
 * @param action 수행된 조치
 * @param repairOperationId 원장에 기록된 복구 작업 ID (NOT_APPLICABLE이면 null)
 * @param outcome secondary 쓰기 결과 (NOT_APPLICABLE이면 null)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record RepairResult(EntityRef ref, RepairAction action, OperationId repairOperationId, WriteOutcome outcome) {

    public RepairResult {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (action != RepairAction.NOT_APPLICABLE && (repairOperationId == null || outcome == null)) {
            throw new IllegalArgumentException("repairOperationId and outcome are required for " + action);
        }
    }

    public static RepairResult notApplicable(EntityRef ref) {
        return new RepairResult(ref, RepairAction.NOT_APPLICABLE, null, null);
    }

    public Optional<WriteOutcome> writeOutcome() {
        return Optional.ofNullable(outcome);
    }

    public boolean isRepaired() {
        return action == RepairAction.REWRITTEN || action == RepairAction.DELETED;
    }
}
