package com.ryuqq.changecontrol.core.exception;

/**
 * Change Control 엔진과 어댑터가 발생시키는 에러 종류.
 *
 * <p>모든 {@link ChangeControlException}은 정확히 하나의 코드를 가집니다. 모든 코드는
 * 로컬에서 복구 가능한 실패를 뜻합니다. 호출자의 요청만 거부되고 엔진 상태는 호출
 * 이전 그대로 유지됩니다.</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public enum ErrorCode {

    INVALID_UID_FORMAT,
    INVALID_VERSION_TREE_ID,
    INVALID_OBJECT_VERSION_ID,
    EMPTY_IDENTIFIER,
    EMPTY_COLLECTION,
    INVALID_LIFECYCLE_STATE,
    INVALID_CHANGE_TYPE,
    INVALID_ATTESTATION_REASON,
    CONTAINER_MISMATCH,
    PRECEDENCE_VIOLATION,
    VERSION_NOT_FOUND,
    NOT_AN_ORIGINAL_VERSION,

    /**
     * Contribution과 함께 커밋된 버전들이 서로 일관되게 참조하지 않음.
     */
    INVALID_CONTRIBUTION,

    /**
     * 영속성 어댑터에 요청한 uid의 VersionedObject가 없음.
     */
    CONTAINER_NOT_FOUND,

    /**
     * 영속성 어댑터에 요청한 uid의 Contribution이 없음.
     */
    CONTRIBUTION_NOT_FOUND,

    /**
     * 생성하려는 uid의 객체가 영속성 어댑터에 이미 있음.
     */
    DUPLICATE_OBJECT,

    /**
     * 설정된 시간 안에 컨테이너 락을 얻지 못함.
     */
    CONTAINER_BUSY
}
