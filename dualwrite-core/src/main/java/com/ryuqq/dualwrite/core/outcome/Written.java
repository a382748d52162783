package com.ryuqq.dualwrite.core.outcome;

/**
 * 스토어 반영 성공.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record Written() implements StoreResult {

    static final Written INSTANCE = new Written();
}
