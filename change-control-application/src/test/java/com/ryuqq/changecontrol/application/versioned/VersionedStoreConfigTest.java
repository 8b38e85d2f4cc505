package com.ryuqq.changecontrol.application.versioned;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * VersionedStoreConfig 검증 테스트.
 */
class VersionedStoreConfigTest {

    @Test
    void constructor_SystemIdOnly_UsesDefaultTimeout() {
        VersionedStoreConfig config = new VersionedStoreConfig("net.example.ehr");

        assertThat(config.systemId()).isEqualTo("net.example.ehr");
        assertThat(config.lockTimeoutMs()).isEqualTo(VersionedStoreConfig.DEFAULT_LOCK_TIMEOUT_MS);
    }

    @Test
    void constructor_BlankSystemId_ThrowsException() {
        assertThatThrownBy(() -> new VersionedStoreConfig(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("systemId");
    }

    @Test
    void constructor_SystemIdNotUid_ThrowsException() {
        assertThatThrownBy(() -> new VersionedStoreConfig("not a uid!"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be a UID");
    }

    @Test
    void constructor_NonPositiveTimeout_ThrowsException() {
        assertThatThrownBy(() -> new VersionedStoreConfig("net.example.ehr", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lockTimeoutMs");
    }

    @Test
    void withMethods_ReturnModifiedCopies() {
        VersionedStoreConfig base = new VersionedStoreConfig("net.example.ehr");

        VersionedStoreConfig other = base.withSystemId("2.16.840.1.113883").withLockTimeoutMs(250);

        assertThat(other.systemId()).isEqualTo("2.16.840.1.113883");
        assertThat(other.lockTimeoutMs()).isEqualTo(250);
        assertThat(base.lockTimeoutMs()).isEqualTo(VersionedStoreConfig.DEFAULT_LOCK_TIMEOUT_MS);
    }
}
