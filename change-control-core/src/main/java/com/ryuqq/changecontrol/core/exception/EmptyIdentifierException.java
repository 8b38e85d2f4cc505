package com.ryuqq.changecontrol.core.exception;

/**
 * 감사 system id 같은 필수 식별자가 비어 있는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class EmptyIdentifierException extends ChangeControlException {

    public EmptyIdentifierException(String message) {
        super(ErrorCode.EMPTY_IDENTIFIER, message);
    }

    public EmptyIdentifierException(String message, Throwable cause) {
        super(ErrorCode.EMPTY_IDENTIFIER, message, cause);
    }
}
