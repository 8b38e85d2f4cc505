package com.ryuqq.changecontrol.core.exception;

/**
 * 값이 ISO OID, UUID, 역방향 인터넷 도메인 중 어느 것도 아니거나, extension이 허용되지 않는
 * 곳에 extension이 붙은 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class InvalidUidFormatException extends ChangeControlException {

    public InvalidUidFormatException(String message) {
        super(ErrorCode.INVALID_UID_FORMAT, message);
    }

    public InvalidUidFormatException(String message, Throwable cause) {
        super(ErrorCode.INVALID_UID_FORMAT, message, cause);
    }
}
