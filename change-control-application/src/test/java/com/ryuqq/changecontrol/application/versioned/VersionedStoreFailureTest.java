package com.ryuqq.changecontrol.application.versioned;

import com.ryuqq.changecontrol.core.exception.DuplicateObjectException;
import com.ryuqq.changecontrol.core.exception.InvalidLifecycleStateException;
import com.ryuqq.changecontrol.core.exception.NotAnOriginalVersionException;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.spi.ChangeControlStore;
import com.ryuqq.changecontrol.core.terminology.AttestationReason;
import com.ryuqq.changecontrol.core.terminology.AuditChangeType;
import com.ryuqq.changecontrol.core.terminology.CodePhrase;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import com.ryuqq.changecontrol.core.terminology.VersionLifecycleState;
import com.ryuqq.changecontrol.core.versioning.OriginalVersion;
import com.ryuqq.changecontrol.core.versioning.VersionedObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;

import static com.ryuqq.changecontrol.testkit.contract.ChangeControlFixtures.*;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 검증 또는 backing store가 실패할 때의 VersionedStore 동작 테스트.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class VersionedStoreFailureTest {

    @Mock
    private ChangeControlStore backend;

    private VersionedStore<String> store;

    @BeforeEach
    void setUp() {
        store = new VersionedStore<>(
            backend,
            TERMINOLOGY,
            new VersionedStoreConfig(SYSTEM_ID),
            Clock.fixed(T0, ZoneOffset.UTC)
        );
    }

    @Test
    void create_InvalidLifecycleState_NeverTouchesStore() {
        // Given
        when(backend.generateContainerId(any())).thenReturn(CONTAINER_UID, contributionUid(1));
        CodedText bogus = CodedText.of("bogus", CodePhrase.of("openehr", "999"));

        // When & Then
        assertThatThrownBy(() -> store.create("v1", ehrRef(), committer(), bogus, null))
            .isInstanceOf(InvalidLifecycleStateException.class);
        verify(backend, never()).createContainer(any(), any());
        verify(backend, never()).commitContributionSet(any(), anyList(), any());
    }

    @Test
    void create_StoreRejectsContribution_PropagatesError() {
        // Given
        when(backend.generateContainerId(any())).thenReturn(CONTAINER_UID, contributionUid(1));
        doThrow(new DuplicateObjectException("already stored"))
            .when(backend).commitContributionSet(any(), anyList(), isNull());

        // When & Then
        assertThatThrownBy(() -> store.create("v1", ehrRef(), committer(), VersionLifecycleState.COMPLETE.codedText(), null))
            .isInstanceOf(DuplicateObjectException.class);
        verify(backend).createContainer(any(), any());
    }

    @Test
    void attest_ImportedVersion_ThrowsAndNeverStores() {
        // Given
        HierObjectId importUid = contributionUid(2);
        ObjectVersionId foreignId = versionId(CONTAINER_UID, OTHER_SYSTEM_ID, "1");
        OriginalVersion<String> foreign = original(contributionUid(1), foreignId, null, T0, "v1");
        VersionedObject<String> container = VersionedObject.create(CONTAINER_UID, ehrRef(), T0);
        container.commitImportedVersion(
            ObjectRef.contribution(importUid),
            audit(AuditChangeType.CREATION, at(1)),
            foreign
        );
        when(backend.<String>retrieveVersionedObject(eq(CONTAINER_UID), any())).thenReturn(container);

        // When & Then
        assertThatThrownBy(() -> store.attest(
            foreignId,
            AttestationRequest.of(committer(), AttestationReason.SIGNED.codedText())
        )).isInstanceOf(NotAnOriginalVersionException.class);
        verify(backend, never()).addAttestation(any(), any());
    }
}
