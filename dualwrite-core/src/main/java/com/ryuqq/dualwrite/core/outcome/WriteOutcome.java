package com.ryuqq.dualwrite.core.outcome;

import com.ryuqq.dualwrite.core.model.OperationId;

/**
 * 한 스토어에 대한 한 번의 쓰기 시도 기록.
 *
 * <p>원장(ledger)에 append-only로 누적되며, 재시도마다 새로운 WriteOutcome이 추가됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>FAILED이면 errorCode 필수</li>
 *   <li>SUCCESS이면 errorCode 없음</li>
 *   <li>attempt는 1 이상, SKIPPED는 0</li>
 * </ul>
 *
 * @param operationId 작업 ID
 * @param store 대상 스토어
 * @param status 결과 상태
 * @param errorCode 실패/건너뜀 사유 (null 가능)
 * @param error 오류 메시지 (null 가능)
 * @param attemptedAt 시도 시각 (epoch millis)
 * @param durationMillis 소요 시간 (밀리초)
 * @param attempt 시도 번호 (1부터, SKIPPED는 0)
 * @param noOp 스토어 상태 변화 없이 성공한 경우 (존재하지 않는 키 삭제)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record WriteOutcome(
    OperationId operationId,
    StoreRole store,
    WriteStatus status,
    WriteErrorCode errorCode,
    String error,
    long attemptedAt,
    long durationMillis,
    int attempt,
    boolean noOp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식 위반 시
     */
    public WriteOutcome {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status == WriteStatus.FAILED && errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null for FAILED outcome");
        }
        if (status == WriteStatus.SUCCESS && errorCode != null) {
            throw new IllegalArgumentException("errorCode must be null for SUCCESS outcome (current: " + errorCode + ")");
        }
        if (durationMillis < 0) {
            throw new IllegalArgumentException("durationMillis must be non-negative (current: " + durationMillis + ")");
        }
        if (status == WriteStatus.SKIPPED ? attempt != 0 : attempt < 1) {
            throw new IllegalArgumentException("attempt is out of range for " + status + " (current: " + attempt + ")");
        }
    }

    public static WriteOutcome success(OperationId operationId, StoreRole store, long attemptedAt,
                                       long durationMillis, int attempt) {
        return new WriteOutcome(operationId, store, WriteStatus.SUCCESS, null, null,
            attemptedAt, durationMillis, attempt, false);
    }

    /**
     * 존재하지 않는 키 삭제 같은 no-op 성공.
     */
    public static WriteOutcome noOp(OperationId operationId, StoreRole store, long attemptedAt,
                                    long durationMillis, int attempt) {
        return new WriteOutcome(operationId, store, WriteStatus.SUCCESS, null, null,
            attemptedAt, durationMillis, attempt, true);
    }

    public static WriteOutcome failed(OperationId operationId, StoreRole store, WriteErrorCode errorCode,
                                      String error, long attemptedAt, long durationMillis, int attempt) {
        return new WriteOutcome(operationId, store, WriteStatus.FAILED, errorCode, error,
            attemptedAt, durationMillis, attempt, false);
    }

    /**
     * 의도적으로 건너뛴 쓰기.
     *
     * @param reason 건너뛴 사유 코드 (null 가능, 설정에 의한 건너뜀이면 null)
     */
    public static WriteOutcome skipped(OperationId operationId, StoreRole store, WriteErrorCode reason,
                                       String error, long attemptedAt) {
        return new WriteOutcome(operationId, store, WriteStatus.SKIPPED, reason, error,
            attemptedAt, 0, 0, false);
    }

    public boolean isSuccess() {
        return status == WriteStatus.SUCCESS;
    }

    public boolean isFailed() {
        return status == WriteStatus.FAILED;
    }

    public boolean isSkipped() {
        return status == WriteStatus.SKIPPED;
    }
}
