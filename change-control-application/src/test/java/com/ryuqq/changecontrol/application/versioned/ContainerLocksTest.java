package com.ryuqq.changecontrol.application.versioned;

import com.ryuqq.changecontrol.core.exception.ContainerBusyException;
import com.ryuqq.changecontrol.core.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.changecontrol.testkit.contract.ChangeControlFixtures.CONTAINER_UID;
import static com.ryuqq.changecontrol.testkit.contract.ChangeControlFixtures.OTHER_CONTAINER_UID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContainerLocksTest {

    @Test
    void constructor_NonPositiveTimeout_ThrowsException() {
        assertThatThrownBy(() -> new ContainerLocks(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acquire_HeldByOtherThread_TimesOutWithContainerBusy() throws Exception {
        // Given
        ContainerLocks locks = new ContainerLocks(50);

        try (ContainerLocks.Held held = locks.acquire(List.of(CONTAINER_UID))) {
            // When
            CompletableFuture<Throwable> other = CompletableFuture.supplyAsync(() -> {
                try (ContainerLocks.Held ignored = locks.acquire(List.of(OTHER_CONTAINER_UID, CONTAINER_UID))) {
                    return null;
                } catch (ContainerBusyException e) {
                    return e;
                }
            });

            // Then
            Throwable failure = other.get(5, TimeUnit.SECONDS);
            assertThat(failure).isInstanceOf(ContainerBusyException.class);
            assertThat(((ContainerBusyException) failure).errorCode()).isEqualTo(ErrorCode.CONTAINER_BUSY);
        }
    }

    @Test
    void acquire_AfterFailedAttempt_PartialLocksAreReleased() throws Exception {
        // Given
        ContainerLocks locks = new ContainerLocks(50);
        ContainerLocks.Held blocker = locks.acquire(List.of(OTHER_CONTAINER_UID));
        // CONTAINER_UID sorts first, so it is taken before the blocked one
        CompletableFuture<Boolean> failed = CompletableFuture.supplyAsync(() -> {
            try (ContainerLocks.Held ignored = locks.acquire(List.of(CONTAINER_UID, OTHER_CONTAINER_UID))) {
                return false;
            } catch (ContainerBusyException e) {
                return true;
            }
        });
        assertThat(failed.get(5, TimeUnit.SECONDS)).isTrue();
        blocker.close();

        // When
        CompletableFuture<Boolean> retried = CompletableFuture.supplyAsync(() -> {
            try (ContainerLocks.Held ignored = locks.acquire(List.of(CONTAINER_UID, OTHER_CONTAINER_UID))) {
                return true;
            }
        });

        // Then
        assertThat(retried.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void acquire_DuplicateIds_LocksOnce() {
        ContainerLocks locks = new ContainerLocks(50);

        try (ContainerLocks.Held held = locks.acquire(List.of(CONTAINER_UID, CONTAINER_UID))) {
            assertThat(held).isNotNull();
        }

        CompletableFuture<Boolean> other = CompletableFuture.supplyAsync(() -> {
            try (ContainerLocks.Held ignored = locks.acquire(List.of(CONTAINER_UID))) {
                return true;
            }
        });
        assertThat(other.join()).isTrue();
    }
}
