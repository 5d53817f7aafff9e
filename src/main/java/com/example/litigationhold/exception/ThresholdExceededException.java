package com.example.litigationhold.exception;

import com.example.litigationhold.domain.enums.RunPhase;
import lombok.Getter;

/**
 * Raised at a batch boundary when the accumulated error count passes the configured cap.
 * Halts the run; outcomes recorded so far are kept for reporting.
 */
@Getter
public class ThresholdExceededException extends RuntimeException {

    private final RunPhase phase;
    private final int batchIndex;
    private final long errorCount;
    private final long maxErrors;

    public ThresholdExceededException(RunPhase phase, int batchIndex, long errorCount, long maxErrors) {
        super(String.format("Error threshold exceeded during %s after batch %d: %d errors (max %d)",
                phase.getDisplayName(), batchIndex, errorCount, maxErrors));
        this.phase = phase;
        this.batchIndex = batchIndex;
        this.errorCount = errorCount;
        this.maxErrors = maxErrors;
    }
}
