package com.example.litigationhold.service.threshold;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of a single run.
 * <p>
 * Updated from the coordinator thread during reconciliation and from worker
 * threads during mutation, so every field is atomic. Counters only grow.
 */
public class RunCounters {

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong eligible = new AtomicLong();
    private final AtomicLong alreadyCompliant = new AtomicLong();
    private final AtomicLong newlyCompliant = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();

    public long addProcessed(long count) {
        return processed.addAndGet(count);
    }

    public long addEligible(long count) {
        return eligible.addAndGet(count);
    }

    public long incrementAlreadyCompliant() {
        return alreadyCompliant.incrementAndGet();
    }

    public long incrementNewlyCompliant() {
        return newlyCompliant.incrementAndGet();
    }

    public long addSkipped(long count) {
        return skipped.addAndGet(count);
    }

    /**
     * Only the error threshold monitor records errors
     */
    long incrementErrors() {
        return errors.incrementAndGet();
    }

    public long getProcessed() {
        return processed.get();
    }

    public long getEligible() {
        return eligible.get();
    }

    public long getAlreadyCompliant() {
        return alreadyCompliant.get();
    }

    public long getNewlyCompliant() {
        return newlyCompliant.get();
    }

    public long getErrors() {
        return errors.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    @Override
    public String toString() {
        return String.format("RunCounters(processed=%d, eligible=%d, alreadyCompliant=%d, newlyCompliant=%d, errors=%d, skipped=%d)",
                getProcessed(), getEligible(), getAlreadyCompliant(), getNewlyCompliant(), getErrors(), getSkipped());
    }
}
