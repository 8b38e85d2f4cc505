package com.ryuqq.changecontrol.core.exception;

/**
 * Change Control 엔진이 보고하는 모든 실패의 기반 타입.
 *
 * <p>실패는 unchecked 예외로 호출 스레드에서 즉시 발생합니다. 프로세스에 치명적인
 * 실패는 없으며, 예외를 던진 작업은 아무런 효과도 남기지 않습니다.</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public abstract class ChangeControlException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ChangeControlException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ChangeControlException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 실패 종류 조회.
     *
     * @return 에러 코드 (null 불가)
     */
    public ErrorCode errorCode() {
        return errorCode;
    }
}
