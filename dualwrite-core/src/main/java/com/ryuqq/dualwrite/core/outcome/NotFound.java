package com.ryuqq.dualwrite.core.outcome;

/**
 * 삭제 대상 키가 존재하지 않음.
 *
 * <p>코디네이터는 이를 no-op 성공으로 기록합니다.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record NotFound() implements StoreResult {

    static final NotFound INSTANCE = new NotFound();
}
