package com.ryuqq.changecontrol.core.exception;

/**
 * 값이 {@code trunk[.branchNumber.branchVersion]} 형식이 아닌 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class InvalidVersionTreeIdException extends ChangeControlException {

    public InvalidVersionTreeIdException(String message) {
        super(ErrorCode.INVALID_VERSION_TREE_ID, message);
    }

    public InvalidVersionTreeIdException(String message, Throwable cause) {
        super(ErrorCode.INVALID_VERSION_TREE_ID, message, cause);
    }
}
