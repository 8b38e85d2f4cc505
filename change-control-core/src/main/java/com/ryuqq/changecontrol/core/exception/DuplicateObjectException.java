package com.ryuqq.changecontrol.core.exception;

/**
 * 영속성 어댑터에 같은 uid의 객체가 이미 저장되어 있는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class DuplicateObjectException extends ChangeControlException {

    public DuplicateObjectException(String message) {
        super(ErrorCode.DUPLICATE_OBJECT, message);
    }

    public DuplicateObjectException(String message, Throwable cause) {
        super(ErrorCode.DUPLICATE_OBJECT, message, cause);
    }
}
