package com.ryuqq.changecontrol.core.exception;

/**
 * 영속성 어댑터에 해당 uid의 Contribution이 없는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class ContributionNotFoundException extends ChangeControlException {

    public ContributionNotFoundException(String message) {
        super(ErrorCode.CONTRIBUTION_NOT_FOUND, message);
    }

    public ContributionNotFoundException(String message, Throwable cause) {
        super(ErrorCode.CONTRIBUTION_NOT_FOUND, message, cause);
    }
}
