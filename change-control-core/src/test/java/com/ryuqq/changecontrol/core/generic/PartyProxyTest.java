package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.identification.GenericId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PartyProxyTest {

    private static final ObjectRef PERSON = ObjectRef.of("demographic", "PERSON", GenericId.of("9912345678", "NHS"));

    @Test
    void partySelf_Anonymous_HasNoReference() {
        assertTrue(PartySelf.anonymous().externalRef().isEmpty());
        assertEquals(PERSON, PartySelf.of(PERSON).externalRef().orElseThrow());
    }

    @Test
    void partyIdentified_NameOrReference_Required() {
        assertEquals("Dr. Jane Test", PartyIdentified.named("Dr. Jane Test").name().orElseThrow());
        assertTrue(PartyIdentified.of(PERSON, null).name().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> PartyIdentified.of(null, null));
    }

    @Test
    void partyIdentified_EmptyName_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> PartyIdentified.named(""));
    }

    @Test
    void equals_ComparesKindAndFields() {
        assertEquals(PartyIdentified.of(PERSON, "Jane"), PartyIdentified.of(PERSON, "Jane"));
        assertNotEquals(PartyIdentified.of(PERSON, "Jane"), PartyIdentified.named("Jane"));
        assertNotEquals(PartySelf.of(PERSON), PartyIdentified.of(PERSON, null));
    }
}
