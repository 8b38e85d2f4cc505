package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidVersionTreeIdException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class VersionTreeIdTest {

    @Test
    void of_TrunkOnly_IsNotBranch() {
        // When
        VersionTreeId id = VersionTreeId.of("12");

        // Then
        assertEquals(12, id.trunkVersion());
        assertFalse(id.isBranch());
        assertEquals(OptionalLong.empty(), id.branchNumber());
        assertEquals(OptionalLong.empty(), id.branchVersion());
    }

    @Test
    void of_BranchForm_ExposesAllParts() {
        // When
        VersionTreeId id = VersionTreeId.of("1.2.3");

        // Then
        assertTrue(id.isBranch());
        assertEquals(1, id.trunkVersion());
        assertEquals(OptionalLong.of(2), id.branchNumber());
        assertEquals(OptionalLong.of(3), id.branchVersion());
        assertEquals("1.2.3", id.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "01", "1.2", "1.0.1", "1.1.0", "1.2.3.4", "", "a", "1..1", "-1"})
    void of_InvalidValues_ThrowInvalidVersionTreeId(String value) {
        assertThrows(InvalidVersionTreeIdException.class, () -> VersionTreeId.of(value));
    }

    @Test
    void of_Null_ThrowsInvalidVersionTreeId() {
        assertThrows(InvalidVersionTreeIdException.class, () -> VersionTreeId.of(null));
    }

    @Test
    void trunkAndNextTrunk_BuildTrunkIds() {
        assertEquals(VersionTreeId.of("4"), VersionTreeId.trunk(4));
        assertEquals(VersionTreeId.of("2"), VersionTreeId.of("1.3.7").nextTrunk());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2147483648", "1.2147483648.1", "9223372036854775807.1.1", "123456789012345678901234567890"})
    void of_PartsBeyondIntRange_RoundTrip(String value) {
        VersionTreeId id = VersionTreeId.of(value);

        assertEquals(value, id.toString());
        assertEquals(id, VersionTreeId.of(id.value()));
    }

    @Test
    void trunkVersion_LongPart_ProjectsAsLong() {
        // When
        VersionTreeId id = VersionTreeId.of("4294967296.3000000000.1");

        // Then
        assertEquals(4294967296L, id.trunkVersion());
        assertEquals(OptionalLong.of(3000000000L), id.branchNumber());
        assertEquals(VersionTreeId.of("4294967297"), id.nextTrunk());
    }

    @Test
    void nextTrunk_BeyondLongRange_StaysExact() {
        // Given
        VersionTreeId id = VersionTreeId.of("9223372036854775807");

        // When
        VersionTreeId next = id.nextTrunk();

        // Then
        assertEquals("9223372036854775808", next.value());
        assertThrows(ArithmeticException.class, next::trunkVersion);
    }

    @Test
    void trunk_NonPositive_ThrowsInvalidVersionTreeId() {
        assertThrows(InvalidVersionTreeIdException.class, () -> VersionTreeId.trunk(0));
    }
}
