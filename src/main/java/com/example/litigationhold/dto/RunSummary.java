package com.example.litigationhold.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of a run, written next to the per-subject report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunSummary {

    private String runId;
    private boolean preview;

    private long totalDiscovered;
    private long skipped;
    private long totalEligible;
    private long alreadyCompliant;

    /**
     * Enabled by this run, or would be enabled in preview
     */
    private long newlyEnabled;

    private long failed;
    private long noTargetResource;
    private long noActionRequired;
    private long totalErrors;

    private boolean halted;
    private String haltReason;

    private Instant startedAt;
    private Instant finishedAt;
    private Duration elapsed;

    private BulkOperationPlan plan;
}
