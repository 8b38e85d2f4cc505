package com.ryuqq.changecontrol.core.exception;

/**
 * 버전 ID가 커밋 대상 VersionedObject에 속하지 않는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class ContainerMismatchException extends ChangeControlException {

    public ContainerMismatchException(String message) {
        super(ErrorCode.CONTAINER_MISMATCH, message);
    }

    public ContainerMismatchException(String message, Throwable cause) {
        super(ErrorCode.CONTAINER_MISMATCH, message, cause);
    }
}
