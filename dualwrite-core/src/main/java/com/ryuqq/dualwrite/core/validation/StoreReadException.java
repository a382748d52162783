package com.ryuqq.dualwrite.core.validation;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.outcome.StoreRole;

/**
 * 검증 중 스토어 읽기 실패 또는 타임아웃.
 *
 * <p>쓰기 실패와 달리 읽기 실패는 비교 결과를 만들 수 없으므로 예외로 전파됩니다.
 * 페이지 검증은 마지막 커서부터 다시 실행할 수 있습니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public class StoreReadException extends RuntimeException {

    private final StoreRole store;

    public StoreReadException(StoreRole store, String message, Throwable cause) {
        super(message, cause);
        this.store = store;
    }

    public StoreReadException(StoreRole store, String message) {
        super(message);
        this.store = store;
    }

    public StoreRole getStore() {
        return store;
    }

    /**
     * 엔티티 읽기 실패 예외 생성.
     */
    public static StoreReadException forEntity(StoreRole store, EntityRef ref, String reason, Throwable cause) {
        return new StoreReadException(store, "Failed to read " + ref + " from " + store + ": " + reason, cause);
    }
}
