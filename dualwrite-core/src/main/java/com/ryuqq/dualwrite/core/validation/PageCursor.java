package com.ryuqq.dualwrite.core.validation;

import com.ryuqq.dualwrite.core.model.EntityKey;

/**
 * 페이지 검증 재개 위치.
 *
 * <p>커서는 (스캔 단계, 마지막으로 처리한 키)를 담으며 불투명 문자열로 직렬화되어
 * 운영 도구가 중단된 검증을 이어서 실행할 수 있습니다.</p>
 *
 * <p><strong>인코딩:</strong> {@code "P:"} 또는 {@code "S:"} 뒤에 마지막 키 (없으면 빈 문자열).
 * 키에 ':'가 포함되어도 첫 구분자만 사용하므로 안전합니다.</p>
 *
 * @param phase 스캔 단계
 * @param afterKey 마지막 처리 키 (null이면 단계의 처음부터)
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public record PageCursor(ScanPhase phase, EntityKey afterKey) {

    public PageCursor {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
    }

    /**
     * 전체 패스의 시작 커서.
     *
     * @return PRIMARY 단계의 처음
     */
    public static PageCursor start() {
        return new PageCursor(ScanPhase.PRIMARY, null);
    }

    /**
     * 문자열 커서 해석.
     *
     * @param encoded {@link #encode()}로 만든 문자열 (null이면 시작 커서)
     * @return 커서
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static PageCursor decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return start();
        }
        int separator = encoded.indexOf(':');
        if (separator != 1) {
            throw new IllegalArgumentException("Malformed page cursor: " + encoded);
        }
        ScanPhase phase;
        switch (encoded.charAt(0)) {
            case 'P':
                phase = ScanPhase.PRIMARY;
                break;
            case 'S':
                phase = ScanPhase.SECONDARY;
                break;
            default:
                throw new IllegalArgumentException("Unknown scan phase in page cursor: " + encoded);
        }
        String key = encoded.substring(separator + 1);
        return new PageCursor(phase, key.isEmpty() ? null : EntityKey.of(key));
    }

    public String encode() {
        char tag = phase == ScanPhase.PRIMARY ? 'P' : 'S';
        return tag + ":" + (afterKey == null ? "" : afterKey.getValue());
    }

    @Override
    public String toString() {
        return "PageCursor{" + encode() + '}';
    }
}
