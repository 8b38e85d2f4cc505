package com.ryuqq.changecontrol.core.exception;

/**
 * 코드화된 attestation reason이 attestation reason 그룹에 없는 경우 발생.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class InvalidAttestationReasonException extends ChangeControlException {

    public InvalidAttestationReasonException(String message) {
        super(ErrorCode.INVALID_ATTESTATION_REASON, message);
    }

    public InvalidAttestationReasonException(String message, Throwable cause) {
        super(ErrorCode.INVALID_ATTESTATION_REASON, message, cause);
    }
}
