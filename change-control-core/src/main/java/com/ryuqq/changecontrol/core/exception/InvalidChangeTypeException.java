package com.ryuqq.changecontrol.core.exception;

/**
 * 감사 change type 코드가 audit change type 그룹에 없는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class InvalidChangeTypeException extends ChangeControlException {

    public InvalidChangeTypeException(String message) {
        super(ErrorCode.INVALID_CHANGE_TYPE, message);
    }

    public InvalidChangeTypeException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CHANGE_TYPE, message, cause);
    }
}
