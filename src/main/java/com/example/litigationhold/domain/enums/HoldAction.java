package com.example.litigationhold.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Per-subject classification in the run report.
 * Every reported subject carries exactly one of these.
 */
@Getter
@RequiredArgsConstructor
public enum HoldAction {

    /**
     * Hold was already enabled when the status was reconciled.
     */
    ALREADY_COMPLIANT("already_compliant", "Already compliant"),

    /**
     * Subject has no mailbox to put on hold.
     */
    NO_TARGET_RESOURCE("no_target_resource", "No mailbox"),

    /**
     * Preview run; the hold would have been enabled.
     */
    PREVIEW_WOULD_ENABLE("preview_would_enable", "Would enable (preview)"),

    /**
     * Hold was enabled by this run.
     */
    ENABLED("enabled", "Enabled"),

    /**
     * Enabling the hold failed.
     */
    FAILED("failed", "Failed"),

    /**
     * Nothing was done, including subjects not reached because the run halted.
     */
    NO_ACTION_REQUIRED("no_action_required", "No action required");

    private final String code;
    private final String displayName;

    @JsonValue
    public String getCode() {
        return code;
    }
}
