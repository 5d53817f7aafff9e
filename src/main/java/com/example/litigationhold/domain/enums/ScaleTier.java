package com.example.litigationhold.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Environment size ladder used to pick base batch and concurrency settings.
 * <p>
 * Tiers are declared from smallest to largest; the first tier whose
 * exclusive upper bound is above the subject count applies.
 */
@Getter
@RequiredArgsConstructor
public enum ScaleTier {

    SMALL(1_000, 100, 5, 20, "Any time", null),
    MEDIUM(10_000, 250, 8, 15, "Any time", null),
    LARGE(50_000, 500, 10, 10, "Outside business hours", null),
    X_LARGE(100_000, 750, 15, 10, "Outside business hours", null),
    ENTERPRISE(Long.MAX_VALUE, 1000, 20, 5, "Off-peak window (nights or weekends)",
            "Large environment — prefer off-peak window");

    /**
     * Exclusive upper bound on the subject count
     */
    private final long upperBound;

    private final int batchSize;
    private final int concurrencyLimit;

    /**
     * Number of batches between advisory memory cleanups
     */
    private final int cleanupInterval;

    private final String recommendedWindow;

    /**
     * Advisory warning attached to this tier, if any
     */
    private final String warning;

    public static ScaleTier forSubjectCount(long subjectCount) {
        for (var tier : values()) {
            if (subjectCount < tier.upperBound) {
                return tier;
            }
        }
        return ENTERPRISE;
    }
}
