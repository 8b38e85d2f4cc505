package com.ryuqq.changecontrol.core.exception;

/**
 * 영속성 어댑터에 해당 uid의 VersionedObject가 없는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class ContainerNotFoundException extends ChangeControlException {

    public ContainerNotFoundException(String message) {
        super(ErrorCode.CONTAINER_NOT_FOUND, message);
    }

    public ContainerNotFoundException(String message, Throwable cause) {
        super(ErrorCode.CONTAINER_NOT_FOUND, message, cause);
    }
}
