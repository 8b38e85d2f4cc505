package com.ryuqq.changecontrol.core.exception;

/**
 * Contribution과 그 버전들이 서로 일관되게 참조하지 않는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class InvalidContributionException extends ChangeControlException {

    public InvalidContributionException(String message) {
        super(ErrorCode.INVALID_CONTRIBUTION, message);
    }

    public InvalidContributionException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CONTRIBUTION, message, cause);
    }
}
