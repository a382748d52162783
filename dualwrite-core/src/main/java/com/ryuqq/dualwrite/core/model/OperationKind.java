package com.ryuqq.dualwrite.core.model;

/**
 * 쓰기 작업 종류.
 *
 * <ul>
 *   <li>CREATE: 신규 생성. 이미 존재하는 키면 DUPLICATE_KEY로 실패 (Update로 변환하지 않음)</li>
 *   <li>UPDATE: 갱신. 키가 없으면 생성 (upsert)</li>
 *   <li>DELETE: 삭제. 키가 없으면 no-op 성공 (멱등 삭제)</li>
 * </ul>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public enum OperationKind {

    CREATE,

    UPDATE,

    DELETE;

    /**
     * payload가 필요한 종류인지 확인.
     *
     * @return CREATE 또는 UPDATE이면 true
     */
    public boolean carriesPayload() {
        return this != DELETE;
    }
}
