package com.ryuqq.dualwrite.core.outcome;

/**
 * 쓰기 대상 스토어의 역할.
 *
 * <ul>
 *   <li>PRIMARY: 신규 서비스 전용 DB (향후 system of record)</li>
 *   <li>SECONDARY: 단계적으로 폐기되는 레거시 공유 DB</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum StoreRole {

    PRIMARY,

    SECONDARY
}
