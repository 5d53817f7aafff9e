package com.example.litigationhold.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Phases of a bulk run, in execution order.
 */
@Getter
@RequiredArgsConstructor
public enum RunPhase {

    PRECONDITIONS("Precondition checks"),
    DISCOVERY("Subject discovery"),
    RECONCILIATION("Status reconciliation"),
    MUTATION("Litigation hold update"),
    REPORTING("Reporting");

    private final String displayName;
}
