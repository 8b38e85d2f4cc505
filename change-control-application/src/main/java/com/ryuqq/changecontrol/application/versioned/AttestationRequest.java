package com.ryuqq.changecontrol.application.versioned;

import com.ryuqq.changecontrol.core.generic.MultimediaRef;
import com.ryuqq.changecontrol.core.generic.PartyProxy;
import com.ryuqq.changecontrol.core.terminology.TextValue;

import java.util.List;

/**
 * party가 버전에 대해 증명하려는 내용. system id와 시각은 Store가 채웁니다.
 *
 * @param attester 증명하는 party
 * @param reason 사유 (attestation reason 그룹의 코드 또는 자유 텍스트)
 * @param pending 서명 대기 중이면 true
 * @param description 선택 설명 (없으면 null)
 * @param attestedView 선택 렌더링 view (없으면 null)
 * @param proof 선택 증명 (없으면 null)
 * @param items 선택 증명 항목 경로 (없으면 null)
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record AttestationRequest(
    PartyProxy attester,
    TextValue reason,
    boolean pending,
    TextValue description,
    MultimediaRef attestedView,
    String proof,
    List<String> items
) {

    public AttestationRequest {
        if (attester == null) {
            throw new IllegalArgumentException("attester cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
    }

    public static AttestationRequest of(PartyProxy attester, TextValue reason) {
        return new AttestationRequest(attester, reason, false, null, null, null, null);
    }
}
