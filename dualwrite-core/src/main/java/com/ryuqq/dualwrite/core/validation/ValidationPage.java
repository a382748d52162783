package com.ryuqq.dualwrite.core.validation;

import java.util.List;
import java.util.Optional;

/**
 * 페이지 검증 한 번의 결과.
 *
 * @param diffs 이 페이지의 비교 보고
 * @param nextCursor 다음 페이지 커서 (null이면 전체 패스 완료)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record ValidationPage(List<DiffRecord> diffs, PageCursor nextCursor) {

    public ValidationPage {
        if (diffs == null) {
            throw new IllegalArgumentException("diffs cannot be null");
        }
        diffs = List.copyOf(diffs);
    }

    public Optional<PageCursor> next() {
        return Optional.ofNullable(nextCursor);
    }

    public boolean isLast() {
        return nextCursor == null;
    }
}
