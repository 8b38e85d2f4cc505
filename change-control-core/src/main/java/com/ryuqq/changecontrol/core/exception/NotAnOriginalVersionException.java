package com.ryuqq.changecontrol.core.exception;

/**
 * attestation 대상이 imported version인 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class NotAnOriginalVersionException extends ChangeControlException {

    public NotAnOriginalVersionException(String message) {
        super(ErrorCode.NOT_AN_ORIGINAL_VERSION, message);
    }

    public NotAnOriginalVersionException(String message, Throwable cause) {
        super(ErrorCode.NOT_AN_ORIGINAL_VERSION, message, cause);
    }
}
