package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.exception.EmptyCollectionException;
import com.ryuqq.changecontrol.core.exception.InvalidAttestationReasonException;
import com.ryuqq.changecontrol.core.spi.TerminologyValidator;
import com.ryuqq.changecontrol.core.terminology.AuditChangeType;
import com.ryuqq.changecontrol.core.terminology.CodeGroupCheck;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import com.ryuqq.changecontrol.core.terminology.TerminologyGroup;
import com.ryuqq.changecontrol.core.terminology.TextValue;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 이미 커밋된 original version에 대해 나중에 추가하는 서명 또는 입회 진술.
 *
 * <p>Attestation은 committer가 증명 당사자인 {@link AuditDetails}입니다. 버전 자체와
 * 컨테이너의 revision history 양쪽에 기록됩니다.</p>
 *
 * <p><strong>추가 필드:</strong></p>
 * <ul>
 *   <li><strong>reason:</strong> attestation 사유. 코드화된 사유는 <em>attestation reason</em>
 *       그룹에 속해야 함</li>
 *   <li><strong>isPending:</strong> 서명 대기 중이면 true</li>
 *   <li><strong>attestedView:</strong> 증명 대상의 렌더링 뷰 (선택)</li>
 *   <li><strong>proof:</strong> 증명 자료 (선택, 예: 서명 블록)</li>
 *   <li><strong>items:</strong> 증명 대상 항목 경로 (선택, 주어지면 비어 있을 수 없음)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Attestation attestation = Attestation.builder()
 *     .systemId("net.example.ehr")
 *     .timeCommitted(now)
 *     .committer(PartyIdentified.named("Dr. Kim"))
 *     .reason(AttestationReason.SIGNED.codedText())
 *     .build(OpenEhrSupportTerminology.instance());
 * </pre>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class Attestation extends AuditDetails {

    private final TextValue reason;
    private final boolean pending;
    private final MultimediaRef attestedView;
    private final String proof;
    private final List<String> items;

    private Attestation(Builder builder, TerminologyValidator terminology) {
        super(
            builder.systemId,
            builder.timeCommitted,
            builder.changeType,
            builder.description,
            builder.committer,
            terminology
        );
        if (builder.items != null && builder.items.isEmpty()) {
            throw new EmptyCollectionException("items must not be empty when provided");
        }
        if (builder.reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (builder.reason instanceof CodedText) {
            CodedText codedReason = (CodedText) builder.reason;
            CodeGroupCheck.requireCodeInGroup(
                terminology,
                codedReason.definingCode(),
                TerminologyGroup.ATTESTATION_REASON,
                InvalidAttestationReasonException::new
            );
        }
        this.reason = builder.reason;
        this.pending = builder.pending;
        this.attestedView = builder.attestedView;
        this.proof = builder.proof;
        this.items = builder.items == null ? null : List.copyOf(builder.items);
    }

    public static Builder builder() {
        return new Builder();
    }

    public TextValue reason() {
        return reason;
    }

    public boolean isPending() {
        return pending;
    }

    public Optional<MultimediaRef> attestedView() {
        return Optional.ofNullable(attestedView);
    }

    public Optional<String> proof() {
        return Optional.ofNullable(proof);
    }

    /**
     * 증명 대상 항목 경로 조회.
     *
     * @return 수정 불가능한 리스트, 버전 전체를 증명했다면 빈 리스트
     */
    public List<String> items() {
        return items == null ? List.of() : items;
    }

    public boolean hasItems() {
        return items != null;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        Attestation that = (Attestation) o;
        return pending == that.pending
            && reason.equals(that.reason)
            && Objects.equals(attestedView, that.attestedView)
            && Objects.equals(proof, that.proof)
            && Objects.equals(items, that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), reason, pending, attestedView, proof, items);
    }

    /**
     * {@link Attestation} Builder. change type 기본값은 {@link AuditChangeType#ATTESTATION}.
     */
    public static final class Builder {

        private String systemId;
        private Instant timeCommitted;
        private CodedText changeType = AuditChangeType.ATTESTATION.codedText();
        private TextValue description;
        private PartyProxy committer;
        private TextValue reason;
        private boolean pending;
        private MultimediaRef attestedView;
        private String proof;
        private List<String> items;

        private Builder() {
        }

        public Builder systemId(String systemId) {
            this.systemId = systemId;
            return this;
        }

        public Builder timeCommitted(Instant timeCommitted) {
            this.timeCommitted = timeCommitted;
            return this;
        }

        public Builder changeType(CodedText changeType) {
            this.changeType = changeType;
            return this;
        }

        public Builder description(TextValue description) {
            this.description = description;
            return this;
        }

        public Builder committer(PartyProxy committer) {
            this.committer = committer;
            return this;
        }

        public Builder reason(TextValue reason) {
            this.reason = reason;
            return this;
        }

        public Builder pending(boolean pending) {
            this.pending = pending;
            return this;
        }

        public Builder attestedView(MultimediaRef attestedView) {
            this.attestedView = attestedView;
            return this;
        }

        public Builder proof(String proof) {
            this.proof = proof;
            return this;
        }

        public Builder items(List<String> items) {
            this.items = items;
            return this;
        }

        /**
         * 검증 후 Attestation 생성.
         *
         * @param terminology change type과 코드화된 사유를 검사할 validator
         * @return Attestation 인스턴스
         * @throws com.ryuqq.changecontrol.core.exception.EmptyIdentifierException systemId가 비어 있는 경우
         * @throws com.ryuqq.changecontrol.core.exception.InvalidChangeTypeException change type이 거부된 경우
         * @throws EmptyCollectionException items가 주어졌지만 비어 있는 경우
         * @throws InvalidAttestationReasonException 코드화된 사유가 거부된 경우
         */
        public Attestation build(TerminologyValidator terminology) {
            return new Attestation(this, terminology);
        }
    }
}
