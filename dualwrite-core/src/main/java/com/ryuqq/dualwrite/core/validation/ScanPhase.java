package com.ryuqq.dualwrite.core.validation;

/**
 * 전체 검증 패스의 스캔 단계.
 *
 * <ul>
 *   <li>PRIMARY: primary 키를 페이지 단위로 읽고 각 키를 secondary와 비교</li>
 *   <li>SECONDARY: secondary 키를 읽고 primary에 없는 키만 보고 (MISSING_IN_PRIMARY)</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum ScanPhase {

    PRIMARY,

    SECONDARY
}
