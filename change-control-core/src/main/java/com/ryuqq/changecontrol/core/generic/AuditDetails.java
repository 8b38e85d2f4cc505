package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.exception.EmptyIdentifierException;
import com.ryuqq.changecontrol.core.exception.InvalidChangeTypeException;
import com.ryuqq.changecontrol.core.spi.TerminologyValidator;
import com.ryuqq.changecontrol.core.terminology.CodeGroupCheck;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import com.ryuqq.changecontrol.core.terminology.TerminologyGroup;
import com.ryuqq.changecontrol.core.terminology.TextValue;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * VersionedObject에 가해진 변경 하나의 감사 기록.
 *
 * <p>누가, 어느 시스템에서, 언제, 어떤 종류의 변경을 커밋했는지 기록합니다. 모든 버전은
 * commit audit으로 하나씩 가지며, Attestation이 이를 확장합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>systemId:</strong> 변경이 커밋된 시스템 (빈 값 불가)</li>
 *   <li><strong>timeCommitted:</strong> 커밋 시각 (호출자가 제공)</li>
 *   <li><strong>changeType:</strong> <em>audit change type</em> 그룹의 코드</li>
 *   <li><strong>description:</strong> 변경 사유 (선택)</li>
 *   <li><strong>committer:</strong> 변경을 커밋한 party</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * AuditDetails audit = AuditDetails.of(
 *     "net.example.ehr",
 *     Instant.parse("2024-03-01T10:15:30Z"),
 *     AuditChangeType.CREATION.codedText(),
 *     null,
 *     PartyIdentified.named("Dr. Kim"),
 *     OpenEhrSupportTerminology.instance());
 * </pre>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class AuditDetails {

    private final String systemId;
    private final Instant timeCommitted;
    private final CodedText changeType;
    private final TextValue description;
    private final PartyProxy committer;

    /**
     * @throws EmptyIdentifierException systemId가 null이거나 비어 있는 경우
     * @throws InvalidChangeTypeException changeType이 audit change type 그룹에 없는 경우
     * @throws IllegalArgumentException timeCommitted, changeType, committer 중 하나가 null인 경우
     */
    protected AuditDetails(
        String systemId,
        Instant timeCommitted,
        CodedText changeType,
        TextValue description,
        PartyProxy committer,
        TerminologyValidator terminology
    ) {
        if (systemId == null || systemId.isEmpty()) {
            throw new EmptyIdentifierException("systemId cannot be null or empty");
        }
        if (timeCommitted == null) {
            throw new IllegalArgumentException("timeCommitted cannot be null");
        }
        if (changeType == null) {
            throw new IllegalArgumentException("changeType cannot be null");
        }
        if (committer == null) {
            throw new IllegalArgumentException("committer cannot be null");
        }
        CodeGroupCheck.requireCodeInGroup(
            terminology,
            changeType.definingCode(),
            TerminologyGroup.AUDIT_CHANGE_TYPE,
            InvalidChangeTypeException::new
        );
        this.systemId = systemId;
        this.timeCommitted = timeCommitted;
        this.changeType = changeType;
        this.description = description;
        this.committer = committer;
    }

    /**
     * 감사 기록 생성.
     *
     * @param systemId 커밋 시스템
     * @param timeCommitted 커밋 시각
     * @param changeType change type 코드
     * @param description 설명 (없으면 null)
     * @param committer 커밋한 party
     * @param terminology change type 검사용 validator
     * @return AuditDetails 인스턴스
     * @throws EmptyIdentifierException systemId가 비어 있는 경우
     * @throws InvalidChangeTypeException validator가 changeType을 거부한 경우
     */
    public static AuditDetails of(
        String systemId,
        Instant timeCommitted,
        CodedText changeType,
        TextValue description,
        PartyProxy committer,
        TerminologyValidator terminology
    ) {
        return new AuditDetails(systemId, timeCommitted, changeType, description, committer, terminology);
    }

    public String systemId() {
        return systemId;
    }

    public Instant timeCommitted() {
        return timeCommitted;
    }

    public CodedText changeType() {
        return changeType;
    }

    public Optional<TextValue> description() {
        return Optional.ofNullable(description);
    }

    public PartyProxy committer() {
        return committer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AuditDetails that = (AuditDetails) o;
        return systemId.equals(that.systemId)
            && timeCommitted.equals(that.timeCommitted)
            && changeType.equals(that.changeType)
            && Objects.equals(description, that.description)
            && committer.equals(that.committer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemId, timeCommitted, changeType, description, committer);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{systemId='" + systemId + "', timeCommitted=" + timeCommitted
            + ", changeType=" + changeType.value() + ", committer=" + committer + "}";
    }
}
