package com.ryuqq.dualwrite.core.outcome;

/**
 * 이중 쓰기 전체 결과.
 *
 * <ul>
 *   <li>SUCCESS: 두 스토어 모두 성공, 또는 secondary를 의도적으로 건너뜀/지연</li>
 *   <li>PARTIAL_SUCCESS: primary 성공, secondary 실패를 정책이 허용 (재시도 큐에 등록됨)</li>
 *   <li>FAILED: primary 실패 (항상 치명적), 또는 fail_on_legacy_error 정책에 의한 승격</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum OverallStatus {

    SUCCESS,

    PARTIAL_SUCCESS,

    FAILED
}
