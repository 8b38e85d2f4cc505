package com.ryuqq.changecontrol.core.terminology;

import com.ryuqq.changecontrol.core.exception.ChangeControlException;
import com.ryuqq.changecontrol.core.exception.InvalidChangeTypeException;
import com.ryuqq.changecontrol.core.spi.TerminologyValidator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * openEHR support terminology와 그룹 검사 테스트.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
class OpenEhrSupportTerminologyTest {

    private final OpenEhrSupportTerminology terminology = OpenEhrSupportTerminology.instance();

    // ========== 그룹 멤버십 ==========

    @Test
    void verifyCodeInGroup_KnownCodes_ReturnsTrue() {
        assertTrue(terminology.verifyCodeInGroup(AuditChangeType.CREATION.codePhrase(), TerminologyGroup.AUDIT_CHANGE_TYPE));
        assertTrue(terminology.verifyCodeInGroup(VersionLifecycleState.COMPLETE.codePhrase(), TerminologyGroup.VERSION_LIFECYCLE_STATE));
        assertTrue(terminology.verifyCodeInGroup(AttestationReason.WITNESSED.codePhrase(), TerminologyGroup.ATTESTATION_REASON));
    }

    @Test
    void verifyCodeInGroup_CodeOfOtherGroup_ReturnsFalse() {
        assertFalse(terminology.verifyCodeInGroup(AuditChangeType.CREATION.codePhrase(), TerminologyGroup.VERSION_LIFECYCLE_STATE));
    }

    @Test
    void verifyCodeInGroup_DeletedIsSharedByTwoGroups() {
        CodePhrase deleted = CodePhrase.of("openehr", "523");

        assertTrue(terminology.verifyCodeInGroup(deleted, TerminologyGroup.AUDIT_CHANGE_TYPE));
        assertTrue(terminology.verifyCodeInGroup(deleted, TerminologyGroup.VERSION_LIFECYCLE_STATE));
    }

    @Test
    void verifyCodeInGroup_OtherTerminology_ReturnsFalse() {
        assertFalse(terminology.verifyCodeInGroup(CodePhrase.of("local", "532"), TerminologyGroup.VERSION_LIFECYCLE_STATE));
    }

    @Test
    void verifyCodeInGroup_NullArguments_ReturnsFalse() {
        assertFalse(terminology.verifyCodeInGroup(null, TerminologyGroup.AUDIT_CHANGE_TYPE));
        assertFalse(terminology.verifyCodeInGroup(AuditChangeType.CREATION.codePhrase(), null));
    }

    @Test
    void codesFor_ListsEveryEnumCode() {
        assertEquals(9, terminology.codesFor(TerminologyGroup.AUDIT_CHANGE_TYPE).size());
        assertEquals(5, terminology.codesFor(TerminologyGroup.VERSION_LIFECYCLE_STATE).size());
        assertTrue(terminology.codesFor(TerminologyGroup.ATTESTATION_REASON).contains("240"));
    }

    // ========== Enum 조회 ==========

    @Test
    void fromCode_KnownAndUnknown() {
        assertEquals(AuditChangeType.FORMAT_CONVERSION, AuditChangeType.fromCode("817").orElseThrow());
        assertTrue(VersionLifecycleState.fromCode("999").isEmpty());
        assertEquals(AttestationReason.SIGNED, AttestationReason.fromCode("240").orElseThrow());
    }

    @Test
    void fromCodedText_OtherTerminology_ReturnsEmpty() {
        CodedText local = CodedText.of("complete", CodePhrase.of("local", "532"));

        assertTrue(VersionLifecycleState.fromCodedText(local).isEmpty());
        assertEquals(
            VersionLifecycleState.COMPLETE,
            VersionLifecycleState.fromCodedText(VersionLifecycleState.COMPLETE.codedText()).orElseThrow()
        );
    }

    @Test
    void codedText_CarriesRubricAndCode() {
        CodedText text = AuditChangeType.AMENDMENT.codedText();

        assertEquals("amendment", text.value());
        assertEquals("250", text.code());
        assertEquals("openehr::250", text.definingCode().toString());
    }

    // ========== CodeGroupCheck ==========

    @Test
    void requireCodeInGroup_Member_Passes() {
        assertDoesNotThrow(() -> CodeGroupCheck.requireCodeInGroup(
            terminology, AuditChangeType.CREATION.codePhrase(), TerminologyGroup.AUDIT_CHANGE_TYPE, InvalidChangeTypeException::new
        ));
    }

    @Test
    void requireCodeInGroup_NonMember_ThrowsGivenFailure() {
        InvalidChangeTypeException exception = assertThrows(
            InvalidChangeTypeException.class,
            () -> CodeGroupCheck.requireCodeInGroup(
                terminology, CodePhrase.of("openehr", "532"), TerminologyGroup.AUDIT_CHANGE_TYPE, InvalidChangeTypeException::new
            )
        );
        assertTrue(exception.getMessage().contains("audit change type"));
        assertNull(exception.getCause());
    }

    @Test
    void requireCodeInGroup_ValidatorFails_WrapsCause() {
        TerminologyValidator broken = (code, group) -> {
            throw new IllegalStateException("terminology service down");
        };

        ChangeControlException exception = assertThrows(
            InvalidChangeTypeException.class,
            () -> CodeGroupCheck.requireCodeInGroup(
                broken, AuditChangeType.CREATION.codePhrase(), TerminologyGroup.AUDIT_CHANGE_TYPE, InvalidChangeTypeException::new
            )
        );
        assertInstanceOf(IllegalStateException.class, exception.getCause());
    }

    @Test
    void requireCodeInGroup_NullValidator_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> CodeGroupCheck.requireCodeInGroup(
            null, AuditChangeType.CREATION.codePhrase(), TerminologyGroup.AUDIT_CHANGE_TYPE, InvalidChangeTypeException::new
        ));
    }
}
