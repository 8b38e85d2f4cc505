package com.ryuqq.changecontrol.core.versioning;

import com.ryuqq.changecontrol.core.exception.EmptyCollectionException;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.terminology.AuditChangeType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ryuqq.changecontrol.core.CoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ContributionTest {

    @Test
    void of_EmptyVersions_ThrowsEmptyCollection() {
        assertThrows(
            EmptyCollectionException.class,
            () -> Contribution.of(CONTRIBUTION_UID, List.of(), audit(AuditChangeType.CREATION, T0))
        );
    }

    @Test
    void of_CopiesVersionList() {
        // Given
        List<ObjectRef> refs = new ArrayList<>(List.of(Contribution.versionRef(vid("1"))));

        // When
        Contribution contribution = Contribution.of(CONTRIBUTION_UID, refs, audit(AuditChangeType.CREATION, T0));
        refs.add(Contribution.versionRef(vid("2")));

        // Then
        assertEquals(1, contribution.versions().size());
    }

    @Test
    void refs_UseLocalNamespace() {
        ObjectRef versionRef = Contribution.versionRef(vid("1"));
        Contribution contribution = Contribution.of(CONTRIBUTION_UID, List.of(versionRef), audit(AuditChangeType.CREATION, T0));

        assertEquals(ObjectRef.LOCAL_NAMESPACE, versionRef.namespace());
        assertEquals("VERSION", versionRef.type());
        assertEquals(vid("1"), versionRef.id());
        assertEquals(contributionRef(), contribution.ref());
        assertEquals("CONTRIBUTION", contribution.ref().type());
    }
}
