package com.ryuqq.changecontrol.core.exception;

/**
 * 설정된 timeout 안에 컨테이너 락을 획득하지 못한 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class ContainerBusyException extends ChangeControlException {

    public ContainerBusyException(String message) {
        super(ErrorCode.CONTAINER_BUSY, message);
    }

    public ContainerBusyException(String message, Throwable cause) {
        super(ErrorCode.CONTAINER_BUSY, message, cause);
    }
}
