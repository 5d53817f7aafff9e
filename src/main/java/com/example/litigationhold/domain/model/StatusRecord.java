package com.example.litigationhold.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Litigation hold status of a subject's mailbox as reported by the mailbox status service.
 */
@Value
@Builder
public class StatusRecord {

    private static final StatusRecord NO_TARGET_RESOURCE = StatusRecord.builder()
            .complianceEnabled(false)
            .hasTargetResource(false)
            .build();

    boolean complianceEnabled;

    /**
     * When the hold was put in place, if known
     */
    Instant enabledDate;

    /**
     * Who put the hold in place, if known
     */
    String owner;

    /**
     * False when the subject has no mailbox to put on hold
     */
    boolean hasTargetResource;

    public static StatusRecord noTargetResource() {
        return NO_TARGET_RESOURCE;
    }

    /**
     * A mailbox exists and the hold is not yet enabled
     */
    public boolean requiresAction() {
        return hasTargetResource && !complianceEnabled;
    }
}
