package com.ryuqq.changecontrol.core.exception;

/**
 * 값이 {@code objectId::creatingSystemId::versionTreeId} 형식이 아닌 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class InvalidObjectVersionIdException extends ChangeControlException {

    public InvalidObjectVersionIdException(String message) {
        super(ErrorCode.INVALID_OBJECT_VERSION_ID, message);
    }

    public InvalidObjectVersionIdException(String message, Throwable cause) {
        super(ErrorCode.INVALID_OBJECT_VERSION_ID, message, cause);
    }
}
