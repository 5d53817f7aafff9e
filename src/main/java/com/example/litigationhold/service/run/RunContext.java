package com.example.litigationhold.service.run;

import com.example.litigationhold.domain.model.OperationOutcome;
import com.example.litigationhold.domain.model.StatusRecord;
import com.example.litigationhold.dto.BulkOperationPlan;
import com.example.litigationhold.service.threshold.ErrorThresholdMonitor;
import com.example.litigationhold.service.threshold.RunCounters;
import lombok.Getter;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State of one run, handed to each phase in turn.
 * <p>
 * Holds the effective plan, the counters and threshold monitor, and everything the
 * phases learn about each subject. Identities are matched case-insensitively.
 * A status and an outcome can each be recorded at most once per subject.
 */
@Getter
public class RunContext {

    private final String runId;
    private final Instant startedAt;
    private final boolean preview;
    private final BulkOperationPlan plan;
    private final RunCounters counters;
    private final ErrorThresholdMonitor thresholdMonitor;

    private final Map<String, StatusRecord> statuses = new ConcurrentHashMap<>();
    private final Map<String, String> statusErrors = new ConcurrentHashMap<>();
    private final Map<String, OperationOutcome> outcomes = new ConcurrentHashMap<>();

    private volatile String haltReason;

    public RunContext(String runId, Instant startedAt, boolean preview, BulkOperationPlan plan,
                      RunCounters counters, ErrorThresholdMonitor thresholdMonitor) {
        this.runId = runId;
        this.startedAt = startedAt;
        this.preview = preview;
        this.plan = plan;
        this.counters = counters;
        this.thresholdMonitor = thresholdMonitor;
    }

    public static String key(String identity) {
        return identity.toLowerCase(Locale.ROOT);
    }

    /**
     * Attach the reconciled status of a subject
     *
     * @throws IllegalStateException if the subject already has a status
     */
    public void recordStatus(String identity, StatusRecord status) {
        if (statuses.putIfAbsent(key(identity), status) != null) {
            throw new IllegalStateException("Status already recorded for " + identity);
        }
    }

    /**
     * Remember why the status of a subject could not be resolved
     */
    public void recordStatusError(String identity, String errorMessage) {
        statusErrors.put(key(identity), errorMessage);
    }

    /**
     * Record the mutation outcome of a subject
     *
     * @throws IllegalStateException if the subject already has an outcome
     */
    public void recordOutcome(OperationOutcome outcome) {
        if (outcomes.putIfAbsent(key(outcome.getIdentity()), outcome) != null) {
            throw new IllegalStateException("Outcome already recorded for " + outcome.getIdentity());
        }
    }

    public Optional<StatusRecord> getStatus(String identity) {
        return Optional.ofNullable(statuses.get(key(identity)));
    }

    public Optional<String> getStatusError(String identity) {
        return Optional.ofNullable(statusErrors.get(key(identity)));
    }

    public Optional<OperationOutcome> getOutcome(String identity) {
        return Optional.ofNullable(outcomes.get(key(identity)));
    }

    public void halt(String reason) {
        this.haltReason = reason;
    }

    public boolean isHalted() {
        return haltReason != null;
    }
}
