package com.ryuqq.changecontrol.core.versioning;

import com.ryuqq.changecontrol.core.exception.EmptyCollectionException;
import com.ryuqq.changecontrol.core.exception.InvalidLifecycleStateException;
import com.ryuqq.changecontrol.core.terminology.AuditChangeType;
import com.ryuqq.changecontrol.core.terminology.CodePhrase;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.changecontrol.core.CoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class OriginalVersionTest {

    @Test
    void build_Minimal_OptionalFieldsAbsent() {
        // When
        OriginalVersion<String> version = original(vid("1"), null, T0, "payload");

        // Then
        assertEquals(vid("1"), version.uid());
        assertTrue(version.precedingVersionUid().isEmpty());
        assertFalse(version.isMerged());
        assertTrue(version.otherInputVersionUids().isEmpty());
        assertFalse(version.hasAttestations());
        assertTrue(version.signature().isEmpty());
        assertEquals(U, version.ownerId());
        assertFalse(version.isBranch());
    }

    @Test
    void build_UnknownLifecycleCode_ThrowsInvalidLifecycleState() {
        CodedText bogus = CodedText.of("draft", CodePhrase.of("openehr", "999"));

        assertThrows(
            InvalidLifecycleStateException.class,
            () -> baseBuilder().lifecycleState(bogus).build(TERMINOLOGY)
        );
    }

    @Test
    void build_EmptyOtherInputs_ThrowsEmptyCollection() {
        assertThrows(
            EmptyCollectionException.class,
            () -> baseBuilder().otherInputVersionUids(List.of()).build(TERMINOLOGY)
        );
    }

    @Test
    void build_EmptyAttestations_ThrowsEmptyCollection() {
        assertThrows(
            EmptyCollectionException.class,
            () -> baseBuilder().attestations(List.of()).build(TERMINOLOGY)
        );
    }

    @Test
    void build_EmptySignature_ThrowsIllegalArgument() {
        assertThrows(
            IllegalArgumentException.class,
            () -> baseBuilder().signature("").build(TERMINOLOGY)
        );
    }

    @Test
    void build_DuplicateOtherInputs_AreCollapsed() {
        OriginalVersion<String> merged = baseBuilder()
            .otherInputVersionUids(List.of(vid(OTHER_UID, OTHER_SYSTEM_ID, "1"), vid(OTHER_UID, OTHER_SYSTEM_ID, "1")))
            .build(TERMINOLOGY);

        assertTrue(merged.isMerged());
        assertEquals(1, merged.otherInputVersionUids().size());
    }

    @Test
    void attestations_ReturnedListIsReadOnly() {
        OriginalVersion<String> version = baseBuilder()
            .attestations(List.of(attestation(at(1))))
            .build(TERMINOLOGY);

        assertThrows(UnsupportedOperationException.class, () -> version.attestations().add(attestation(at(2))));
        assertEquals(1, version.attestations().size());
    }

    @Test
    void equals_CopyIsEqualButIndependent() {
        OriginalVersion<String> version = original(vid("2"), vid("1"), at(3), "payload");

        OriginalVersion<String> copy = version.copy();

        assertEquals(version, copy);
        assertNotSame(version, copy);
        assertEquals(version.hashCode(), copy.hashCode());
        assertNotEquals(version, original(vid("2"), vid("1"), at(3), "other payload"));
    }

    @Test
    void commitAudit_KeepsChangeType() {
        OriginalVersion<String> version = original(vid("2"), vid("1"), at(3), "payload");

        assertEquals(AuditChangeType.MODIFICATION.code(), version.commitAudit().changeType().code());
    }

    private static OriginalVersion.Builder<String> baseBuilder() {
        return originalBuilder(vid("1"), null, T0, "payload");
    }
}
