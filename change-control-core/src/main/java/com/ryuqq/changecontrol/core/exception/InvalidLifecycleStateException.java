package com.ryuqq.changecontrol.core.exception;

/**
 * lifecycle state 코드가 version lifecycle state 그룹에 없는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class InvalidLifecycleStateException extends ChangeControlException {

    public InvalidLifecycleStateException(String message) {
        super(ErrorCode.INVALID_LIFECYCLE_STATE, message);
    }

    public InvalidLifecycleStateException(String message, Throwable cause) {
        super(ErrorCode.INVALID_LIFECYCLE_STATE, message, cause);
    }
}
