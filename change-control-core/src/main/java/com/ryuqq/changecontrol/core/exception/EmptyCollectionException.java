package com.ryuqq.changecontrol.core.exception;

/**
 * 선택 컬렉션이 주어졌지만 비어 있는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class EmptyCollectionException extends ChangeControlException {

    public EmptyCollectionException(String message) {
        super(ErrorCode.EMPTY_COLLECTION, message);
    }

    public EmptyCollectionException(String message, Throwable cause) {
        super(ErrorCode.EMPTY_COLLECTION, message, cause);
    }
}
