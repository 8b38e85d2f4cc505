package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidObjectVersionIdException;
import com.ryuqq.changecontrol.core.exception.InvalidUidFormatException;
import com.ryuqq.changecontrol.core.exception.InvalidVersionTreeIdException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class ObjectVersionIdTest {

    private static final String CONTAINER = "154b1047-23aa-4d4d-8713-df848fd4d60a";

    @Test
    void of_FullForm_DecomposesParts() {
        // When
        ObjectVersionId id = ObjectVersionId.of(CONTAINER + "::net.example.ehr::2");

        // Then
        assertEquals(HierObjectId.of(CONTAINER), HierObjectId.of(id.objectId()));
        assertEquals(id.root(), id.objectId());
        assertEquals(new InternetId("net.example.ehr"), id.creatingSystemId());
        assertEquals(VersionTreeId.of("2"), id.versionTreeId());
        assertEquals("net.example.ehr::2", id.extension());
        assertFalse(id.isBranch());
    }

    @Test
    void of_BranchTree_IsBranch() {
        ObjectVersionId id = ObjectVersionId.of(CONTAINER + "::2.16.840.1::1.1.2");

        assertTrue(id.isBranch());
        assertInstanceOf(IsoOid.class, id.creatingSystemId());
    }

    @Test
    void of_TreePartBeyondIntRange_RoundTrips() {
        // Given
        String value = CONTAINER + "::net.example.ehr::1.2147483648.1";

        // When
        ObjectVersionId id = ObjectVersionId.of(value);

        // Then
        assertEquals(value, id.value());
        assertEquals(OptionalLong.of(2147483648L), id.versionTreeId().branchNumber());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        CONTAINER,
        CONTAINER + "::net.example.ehr",
        CONTAINER + "::net.example.ehr::1::extra",
        CONTAINER + "::::1"
    })
    void of_WrongNumberOfParts_ThrowsInvalidObjectVersionId(String value) {
        assertThrows(InvalidObjectVersionIdException.class, () -> ObjectVersionId.of(value));
    }

    @Test
    void of_InvalidSystemId_ThrowsInvalidObjectVersionIdWithCause() {
        InvalidObjectVersionIdException exception = assertThrows(
            InvalidObjectVersionIdException.class,
            () -> ObjectVersionId.of(CONTAINER + "::not a system::1")
        );
        assertInstanceOf(InvalidUidFormatException.class, exception.getCause());
    }

    @Test
    void of_InvalidTreeId_ThrowsInvalidObjectVersionIdWithCause() {
        InvalidObjectVersionIdException exception = assertThrows(
            InvalidObjectVersionIdException.class,
            () -> ObjectVersionId.of(CONTAINER + "::net.example.ehr::0")
        );
        assertInstanceOf(InvalidVersionTreeIdException.class, exception.getCause());
    }

    @Test
    void of_InvalidRoot_ThrowsInvalidUidFormat() {
        assertThrows(InvalidUidFormatException.class, () -> ObjectVersionId.of("bad root::net.example.ehr::1"));
    }

    @Test
    void of_Parts_ReproducesLexicalForm() {
        // Given
        String value = CONTAINER + "::org.example.ehr2::3.1.1";

        // When
        ObjectVersionId built = ObjectVersionId.of(
            HierObjectId.of(CONTAINER),
            Uid.parse("org.example.ehr2"),
            VersionTreeId.of("3.1.1")
        );

        // Then
        assertEquals(value, built.value());
        assertEquals(ObjectVersionId.of(value), built);
    }

    @Test
    void of_MissingPart_ThrowsIllegalArgument() {
        assertThrows(
            IllegalArgumentException.class,
            () -> ObjectVersionId.of(HierObjectId.of(CONTAINER), null, VersionTreeId.of("1"))
        );
    }

    @Test
    void equals_DifferentTypesWithSameValue_AreNotEqual() {
        assertNotEquals(HierObjectId.of(CONTAINER), GenericId.of(CONTAINER, "local"));
    }
}
