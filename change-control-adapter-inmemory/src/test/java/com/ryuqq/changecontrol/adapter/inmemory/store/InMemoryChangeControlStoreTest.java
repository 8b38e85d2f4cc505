package com.ryuqq.changecontrol.adapter.inmemory.store;

import com.ryuqq.changecontrol.core.exception.ContainerNotFoundException;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.spi.ContainerHeader;
import com.ryuqq.changecontrol.core.spi.StoreActionType;
import com.ryuqq.changecontrol.core.spi.StoreMetadata;
import com.ryuqq.changecontrol.core.versioning.OriginalVersion;
import com.ryuqq.changecontrol.core.versioning.VersionedObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.changecontrol.testkit.contract.ChangeControlFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Implementation specific tests for {@link InMemoryChangeControlStore}.
 */
class InMemoryChangeControlStoreTest {

    private InMemoryChangeControlStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryChangeControlStore(Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void constructor_NullClock_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryChangeControlStore(null));
    }

    @Test
    void generateContainerId_ReturnsUuidWithoutExtension() {
        // When
        HierObjectId uid = store.generateContainerId();

        // Then
        assertTrue(uid.value().matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
        assertThat(uid.hasExtension()).isFalse();
    }

    @Test
    void retrieveMetadata_UsesInjectedClock() {
        // Given
        store.createContainer(new ContainerHeader(CONTAINER_UID, ehrRef(), T0));

        // When
        StoreMetadata metadata = store.retrieveMetadata(CONTAINER_UID);

        // Then
        assertEquals(T0, metadata.createdAt());
        assertThat(metadata.actions()).allSatisfy(action -> assertEquals(T0, action.occurredAt()));
        assertEquals(1, metadata.count(StoreActionType.CREATE));
    }

    @Test
    void retrieveMetadata_UnknownId_ThrowsContainerNotFound() {
        assertThatThrownBy(() -> store.retrieveMetadata(CONTAINER_UID))
            .isInstanceOf(ContainerNotFoundException.class);
    }

    @Test
    void retrieveVersionedObject_MutatingCopy_DoesNotAffectStore() {
        // Given
        store.createContainer(new ContainerHeader(CONTAINER_UID, ehrRef(), T0));
        OriginalVersion<String> v1 = original(
            contributionUid(1), versionId(CONTAINER_UID, SYSTEM_ID, "1"), null, at(10), "first");
        store.commitContributionSet(contribution(contributionUid(1), at(10), v1), List.of(v1), null);
        VersionedObject<String> copy = store.retrieveVersionedObject(CONTAINER_UID);

        // When
        copy.commitAttestation(attestation(at(20)), v1.uid());

        // Then
        assertThat(copy.revisionHistory().items().get(0).audits()).hasSize(2);
        assertThat(store.retrieveContainer(CONTAINER_UID).revisionHistory().items().get(0).audits()).hasSize(1);
    }

    @Test
    void commitContributionSet_ConcurrentFirstVersions_ExactlyOneWins() throws Exception {
        // Given
        store.createContainer(new ContainerHeader(CONTAINER_UID, ehrRef(), T0));
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                final int n = i + 1;
                results.add(executor.submit(() -> {
                    OriginalVersion<String> v1 = original(
                        contributionUid(n), versionId(CONTAINER_UID, SYSTEM_ID + n, "1"), null, at(n), "v" + n);
                    start.await();
                    try {
                        store.commitContributionSet(contribution(contributionUid(n), at(n), v1), List.of(v1), null);
                        return true;
                    } catch (RuntimeException e) {
                        return false;
                    }
                }));
            }

            // When
            start.countDown();
            int wins = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    wins++;
                }
            }

            // Then
            assertEquals(1, wins);
            assertEquals(1, store.retrieveVersionedObject(CONTAINER_UID).versionCount());
        } finally {
            executor.shutdownNow();
        }
    }
}
