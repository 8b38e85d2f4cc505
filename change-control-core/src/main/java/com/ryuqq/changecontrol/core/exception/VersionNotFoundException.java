package com.ryuqq.changecontrol.core.exception;

/**
 * ID 또는 커밋 시각으로 조회한 버전이 존재하지 않는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class VersionNotFoundException extends ChangeControlException {

    public VersionNotFoundException(String message) {
        super(ErrorCode.VERSION_NOT_FOUND, message);
    }

    public VersionNotFoundException(String message, Throwable cause) {
        super(ErrorCode.VERSION_NOT_FOUND, message, cause);
    }
}
