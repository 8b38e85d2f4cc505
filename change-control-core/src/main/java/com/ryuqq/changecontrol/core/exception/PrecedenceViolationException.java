package com.ryuqq.changecontrol.core.exception;

/**
 * 커밋의 preceding version이 누락되었거나, 알 수 없거나, 허용되지 않는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class PrecedenceViolationException extends ChangeControlException {

    public PrecedenceViolationException(String message) {
        super(ErrorCode.PRECEDENCE_VIOLATION, message);
    }

    public PrecedenceViolationException(String message, Throwable cause) {
        super(ErrorCode.PRECEDENCE_VIOLATION, message, cause);
    }
}
