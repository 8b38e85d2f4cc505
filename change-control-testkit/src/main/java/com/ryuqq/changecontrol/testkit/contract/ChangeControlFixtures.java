package com.ryuqq.changecontrol.testkit.contract;

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
import com.ryuqq.changecontrol.core.versioning.Contribution;
import com.ryuqq.changecontrol.core.versioning.ImportedVersion;
import com.ryuqq.changecontrol.core.versioning.OriginalVersion;
import com.ryuqq.changecontrol.core.versioning.Version;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared test data for change control tests.
 *
 * <p>All times are offsets from {@link #T0}; all ids are built from fixed UUIDs so
 * failures are reproducible.</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class ChangeControlFixtures {

    public static final TerminologyValidator TERMINOLOGY = OpenEhrSupportTerminology.instance();

    public static final String SYSTEM_ID = "net.example.ehr";
    public static final String OTHER_SYSTEM_ID = "org.example.ehr2";

    public static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    public static final HierObjectId CONTAINER_UID = HierObjectId.of("154b1047-23aa-4d4d-8713-df848fd4d60a");
    public static final HierObjectId OTHER_CONTAINER_UID = HierObjectId.of("8d3c6a0e-2b8e-4d52-9e57-3f1f0c1b7a21");
    public static final HierObjectId EHR_UID = HierObjectId.of("7d44b88c-4199-4bad-97dc-d78268e01398");

    private ChangeControlFixtures() {
    }

    public static Instant at(long secondsAfterT0) {
        return T0.plusSeconds(secondsAfterT0);
    }

    public static ObjectRef ehrRef() {
        return ObjectRef.of(ObjectRef.LOCAL_NAMESPACE, "EHR", EHR_UID);
    }

    public static PartyProxy committer() {
        return PartyIdentified.named("Dr. Jane Test");
    }

    public static HierObjectId contributionUid(int n) {
        return HierObjectId.of(String.format("00000000-0000-4000-8000-%012d", n));
    }

    public static ObjectVersionId versionId(HierObjectId container, String systemId, String treeId) {
        return ObjectVersionId.of(container.value() + "::" + systemId + "::" + treeId);
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

    /**
     * Original version in the complete lifecycle state.
     */
    public static <T> OriginalVersion<T> original(
        HierObjectId contribution,
        ObjectVersionId uid,
        ObjectVersionId preceding,
        Instant time,
        T data
    ) {
        return OriginalVersion.<T>builder()
            .contribution(ObjectRef.contribution(contribution))
            .commitAudit(audit(preceding == null ? AuditChangeType.CREATION : AuditChangeType.MODIFICATION, time))
            .uid(uid)
            .precedingVersionUid(preceding)
            .lifecycleState(VersionLifecycleState.COMPLETE.codedText())
            .data(data)
            .build(TERMINOLOGY);
    }

    public static <T> ImportedVersion<T> imported(HierObjectId contribution, Instant time, OriginalVersion<T> item) {
        return ImportedVersion.of(ObjectRef.contribution(contribution), audit(AuditChangeType.CREATION, time), item);
    }

    /**
     * Contribution referencing exactly the given versions.
     */
    public static Contribution contribution(HierObjectId uid, Instant time, Version<?>... versions) {
        List<ObjectRef> refs = new ArrayList<>();
        for (Version<?> version : versions) {
            refs.add(Contribution.versionRef(version.uid()));
        }
        return Contribution.of(uid, refs, audit(AuditChangeType.CREATION, time));
    }
}
