package com.example.litigationhold.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of the mutation phase for a single subject.
 * <p>
 * Exactly one outcome is recorded for every subject the mutation phase reached,
 * whether the change was applied, simulated in preview mode, or failed.
 */
@Value
@Builder
public class OperationOutcome {

    String identity;
    boolean success;
    String errorMessage;
    Instant timestamp;
    boolean preview;

    /**
     * Create a simulated success for preview mode
     */
    public static OperationOutcome preview(String identity) {
        return OperationOutcome.builder()
                .identity(identity)
                .success(true)
                .preview(true)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Create a live success
     */
    public static OperationOutcome success(String identity) {
        return OperationOutcome.builder()
                .identity(identity)
                .success(true)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Create a live failure
     */
    public static OperationOutcome failure(String identity, String errorMessage) {
        return OperationOutcome.builder()
                .identity(identity)
                .success(false)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .build();
    }
}
