package com.ryuqq.changecontrol.core;

import com.ryuqq.changecontrol.core.generic.Attestation;
import com.ryuqq.changecontrol.core.generic.AuditDetails;
import com.ryuqq.changecontrol.core.generic.PartyIdentified;
import com.ryuqq.changecontrol.core.generic.PartyProxy;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.spi.TerminologyValidator;
import com.ryuqq.changecontrol.core.terminology.AttestationReason;
import com.ryuqq.changecontrol.core.terminology.AuditChangeType;
import com.ryuqq.changecontrol.core.terminology.OpenEhrSupportTerminology;
import com.ryuqq.changecontrol.core.terminology.VersionLifecycleState;
import com.ryuqq.changecontrol.core.versioning.OriginalVersion;

import java.time.Instant;

/**
 * core 테스트가 공유하는 테스트 데이터.
 */
public final class CoreFixtures {

    public static final TerminologyValidator TERMINOLOGY = OpenEhrSupportTerminology.instance();

    public static final String SYSTEM_ID = "net.example.ehr";
    public static final String OTHER_SYSTEM_ID = "org.example.ehr2";

    public static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    public static final HierObjectId U = HierObjectId.of("154b1047-23aa-4d4d-8713-df848fd4d60a");
    public static final HierObjectId OTHER_UID = HierObjectId.of("8d3c6a0e-2b8e-4d52-9e57-3f1f0c1b7a21");
    public static final HierObjectId CONTRIBUTION_UID = HierObjectId.of("00000000-0000-4000-8000-000000000001");

    private CoreFixtures() {
    }

    public static Instant at(long secondsAfterT0) {
        return T0.plusSeconds(secondsAfterT0);
    }

    public static ObjectRef ehrRef() {
        return ObjectRef.of(ObjectRef.LOCAL_NAMESPACE, "EHR", HierObjectId.of("7d44b88c-4199-4bad-97dc-d78268e01398"));
    }

    public static ObjectRef contributionRef() {
        return ObjectRef.contribution(CONTRIBUTION_UID);
    }

    public static PartyProxy committer() {
        return PartyIdentified.named("Dr. Jane Test");
    }

    public static ObjectVersionId vid(HierObjectId container, String systemId, String treeId) {
        return ObjectVersionId.of(container.value() + "::" + systemId + "::" + treeId);
    }

    public static ObjectVersionId vid(String treeId) {
        return vid(U, SYSTEM_ID, treeId);
    }

    public static AuditDetails audit(AuditChangeType changeType, Instant time) {
        return AuditDetails.of(SYSTEM_ID, time, changeType.codedText(), null, committer(), TERMINOLOGY);
    }

    public static Attestation attestation(Instant time) {
        return Attestation.builder()
            .systemId(SYSTEM_ID)
            .timeCommitted(time)
            .committer(committer())
            .reason(AttestationReason.SIGNED.codedText())
            .build(TERMINOLOGY);
    }

    public static <T> OriginalVersion.Builder<T> originalBuilder(ObjectVersionId uid, ObjectVersionId preceding, Instant time, T data) {
        return OriginalVersion.<T>builder()
            .contribution(contributionRef())
            .commitAudit(audit(preceding == null ? AuditChangeType.CREATION : AuditChangeType.MODIFICATION, time))
            .uid(uid)
            .precedingVersionUid(preceding)
            .lifecycleState(VersionLifecycleState.COMPLETE.codedText())
            .data(data);
    }

    public static <T> OriginalVersion<T> original(ObjectVersionId uid, ObjectVersionId preceding, Instant time, T data) {
        return CoreFixtures.<T>originalBuilder(uid, preceding, time, data).build(TERMINOLOGY);
    }
}
