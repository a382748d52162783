package com.ryuqq.dualwrite.core.outcome;

/**
 * 쓰기 실패 사유 코드.
 *
 * <p>실패가 primary인지 secondary인지는 {@link WriteOutcome#store()}로 구분합니다.
 * 예외가 아닌 결과 데이터로 전달됩니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum WriteErrorCode {

    /** 이미 존재하는 키에 CREATE 시도 (호출자 오류). */
    DUPLICATE_KEY,

    /** 호출별 타임아웃 초과. 같은 종류의 스토어 오류와 동일하게 취급. */
    TIMEOUT,

    /** 드라이버/연결 오류 등 스토어 자체 실패. */
    STORE_ERROR,

    /** 재시도 큐에서 최대 시도 횟수 소진 (동기 경로에서는 발생하지 않음). */
    RETRIES_EXHAUSTED,

    /** 운영자가 대기 중인 재시도를 취소함. */
    CANCELLED
}
