package com.ryuqq.dualwrite.core.outcome;

/**
 * 스토어 어댑터 쓰기 호출의 결과.
 *
 * <p>StoreResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Written}: 스토어에 반영됨</li>
 *   <li>{@link NotFound}: 삭제 대상 키가 없음 (멱등 삭제로 성공 처리)</li>
 *   <li>{@link Rejected}: 중복 키, 타임아웃, 스토어 오류</li>
 * </ul>
 *
 * <p>실패는 예외가 아닌 값으로 표현되어, secondary 실패가 재시도 로직을 관통하는
 * 예외 경로가 아닌 평범한 분기로 처리됩니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public sealed interface StoreResult permits Written, NotFound, Rejected {

    /**
     * 결과가 성공(반영 또는 no-op)인지 확인.
     *
     * @return Rejected가 아니면 true
     */
    default boolean isSuccessful() {
        return !(this instanceof Rejected);
    }

    static StoreResult written() {
        return Written.INSTANCE;
    }

    static StoreResult notFound() {
        return NotFound.INSTANCE;
    }

    static StoreResult rejected(WriteErrorCode errorCode, String message) {
        return new Rejected(errorCode, message);
    }
}
