package com.example.litigationhold.service.threshold;

import com.example.litigationhold.domain.enums.RunPhase;
import com.example.litigationhold.exception.ThresholdExceededException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Error counter shared by the reconciliation and mutation phases, with the
 * predicate that decides whether the run must halt.
 * <p>
 * Errors may be recorded from any thread. {@link #checkpoint} is only called by
 * the coordinator between batches, so a batch in progress always runs to completion.
 */
@Slf4j
public class ErrorThresholdMonitor {

    private final RunCounters counters;

    @Getter
    private final long maxErrors;

    @Getter
    private final boolean continueOnErrors;

    private final AtomicBoolean overLimitWarned = new AtomicBoolean(false);

    public ErrorThresholdMonitor(RunCounters counters, long maxErrors, boolean continueOnErrors) {
        if (maxErrors < 0) {
            throw new IllegalArgumentException("maxErrors must not be negative, got " + maxErrors);
        }
        this.counters = counters;
        this.maxErrors = maxErrors;
        this.continueOnErrors = continueOnErrors;
    }

    /**
     * Count one failure
     *
     * @param identity Subject the failure belongs to
     * @param reason   What failed
     * @return The error count after this failure
     */
    public long recordError(String identity, String reason) {
        var errors = counters.incrementErrors();
        log.debug("Error {} recorded for {}: {}", errors, identity, reason);

        if (continueOnErrors && errors > maxErrors && overLimitWarned.compareAndSet(false, true)) {
            log.warn("Error count {} is above the limit of {}, continuing because continue-on-errors is set", errors, maxErrors);
        }
        return errors;
    }

    public long getErrorCount() {
        return counters.getErrors();
    }

    /**
     * errors > maxErrors and continue-on-errors is not set
     */
    public boolean shouldAbort() {
        return counters.getErrors() > maxErrors && !continueOnErrors;
    }

    /**
     * Check the threshold at a batch boundary
     *
     * @param phase      Phase that just finished a batch
     * @param batchIndex 1-based index of that batch
     * @throws ThresholdExceededException if the run must halt
     */
    public void checkpoint(RunPhase phase, int batchIndex) {
        if (shouldAbort()) {
            var errors = counters.getErrors();
            log.error("Halting {} after batch {}: {} errors exceed the limit of {}", phase.getDisplayName(), batchIndex, errors, maxErrors);
            throw new ThresholdExceededException(phase, batchIndex, errors, maxErrors);
        }
    }
}
