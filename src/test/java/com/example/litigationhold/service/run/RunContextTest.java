package com.example.litigationhold.service.run;

import com.example.litigationhold.TestFixtures;
import com.example.litigationhold.domain.model.OperationOutcome;
import com.example.litigationhold.domain.model.StatusRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RunContext Tests")
class RunContextTest {

    private final RunContext context = TestFixtures.context(false, TestFixtures.plan(10, 2));

    @Test
    @DisplayName("Should match identities case-insensitively")
    void shouldMatchIdentitiesIgnoringCase() {
        // When
        context.recordStatus("Alice@Contoso.com", StatusRecord.noTargetResource());
        context.recordOutcome(OperationOutcome.success("BOB@contoso.com"));

        // Then
        assertThat(context.getStatus("alice@contoso.com")).contains(StatusRecord.noTargetResource());
        assertThat(context.getOutcome("bob@CONTOSO.com")).isPresent();
        assertThat(context.getStatus("bob@contoso.com")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a second status for the same subject")
    void shouldRejectDuplicateStatus() {
        // Given
        context.recordStatus("alice@contoso.com", StatusRecord.noTargetResource());

        // Then
        assertThatThrownBy(() -> context.recordStatus("ALICE@contoso.com", StatusRecord.noTargetResource()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject a second outcome for the same subject")
    void shouldRejectDuplicateOutcome() {
        // Given
        context.recordOutcome(OperationOutcome.failure("alice@contoso.com", "boom"));

        // Then
        assertThatThrownBy(() -> context.recordOutcome(OperationOutcome.success("alice@contoso.com")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should be halted once a reason is set")
    void shouldTrackHalt() {
        // Given
        assertThat(context.isHalted()).isFalse();

        // When
        context.halt("too many errors");

        // Then
        assertThat(context.isHalted()).isTrue();
        assertThat(context.getHaltReason()).isEqualTo("too many errors");
    }
}
