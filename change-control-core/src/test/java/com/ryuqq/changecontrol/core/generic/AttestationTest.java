package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.exception.EmptyCollectionException;
import com.ryuqq.changecontrol.core.exception.InvalidAttestationReasonException;
import com.ryuqq.changecontrol.core.terminology.AttestationReason;
import com.ryuqq.changecontrol.core.terminology.AuditChangeType;
import com.ryuqq.changecontrol.core.terminology.CodePhrase;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import com.ryuqq.changecontrol.core.terminology.PlainText;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static com.ryuqq.changecontrol.core.CoreFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttestationTest {

    private Attestation.Builder base() {
        return Attestation.builder()
            .systemId(SYSTEM_ID)
            .timeCommitted(T0)
            .committer(committer())
            .reason(AttestationReason.SIGNED.codedText());
    }

    @Test
    void build_Defaults_AttestationChangeTypeAndNoItems() {
        // When
        Attestation attestation = base().build(TERMINOLOGY);

        // Then
        assertThat(attestation.changeType()).isEqualTo(AuditChangeType.ATTESTATION.codedText());
        assertThat(attestation.isPending()).isFalse();
        assertThat(attestation.hasItems()).isFalse();
        assertThat(attestation.items()).isEmpty();
        assertThat(attestation.attestedView()).isEmpty();
        assertThat(attestation.proof()).isEmpty();
    }

    @Test
    void build_AllFields_KeepsThem() {
        // Given
        MultimediaRef view = MultimediaRef.of("application/pdf", URI.create("https://ehr.example.net/views/1.pdf"));

        // When
        Attestation attestation = base()
            .pending(true)
            .attestedView(view)
            .proof("c2lnbmF0dXJl")
            .items(List.of("/content[openEHR-EHR-SECTION.vital_signs.v1]"))
            .description(PlainText.of("countersigned"))
            .build(TERMINOLOGY);

        // Then
        assertThat(attestation.isPending()).isTrue();
        assertThat(attestation.attestedView()).contains(view);
        assertThat(attestation.proof()).contains("c2lnbmF0dXJl");
        assertThat(attestation.items()).containsExactly("/content[openEHR-EHR-SECTION.vital_signs.v1]");
        assertThat(attestation.description()).contains(PlainText.of("countersigned"));
    }

    @Test
    void build_EmptyItems_ThrowsEmptyCollection() {
        assertThatThrownBy(() -> base().items(List.of()).build(TERMINOLOGY))
            .isInstanceOf(EmptyCollectionException.class);
    }

    @Test
    void build_UnknownCodedReason_ThrowsInvalidAttestationReason() {
        CodedText reason = CodedText.of("approved", CodePhrase.of("openehr", "249"));

        assertThatThrownBy(() -> base().reason(reason).build(TERMINOLOGY))
            .isInstanceOf(InvalidAttestationReasonException.class);
    }

    @Test
    void build_FreeTextReason_IsNotValidated() {
        Attestation attestation = base().reason(PlainText.of("reviewed at ward round")).build(TERMINOLOGY);

        assertThat(attestation.reason()).isEqualTo(PlainText.of("reviewed at ward round"));
    }

    @Test
    void build_MissingReason_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> base().reason(null).build(TERMINOLOGY))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reason");
    }

    @Test
    void equals_AttestationNeverEqualsPlainAudit() {
        Attestation attestation = base().build(TERMINOLOGY);
        AuditDetails audit = AuditDetails.of(
            SYSTEM_ID, T0, AuditChangeType.ATTESTATION.codedText(), null, committer(), TERMINOLOGY
        );

        assertThat(attestation).isNotEqualTo(audit);
        assertThat(audit).isNotEqualTo(attestation);
    }
}
