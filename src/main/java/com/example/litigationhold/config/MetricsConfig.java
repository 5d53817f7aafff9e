package com.example.litigationhold.config;

import com.example.litigationhold.domain.enums.RunPhase;
import com.example.litigationhold.dto.RunSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for litigation hold runs.
 * <p>
 * Exposes Micrometer meters for:
 * - Status queries by mode and result
 * - Hold updates and their latency
 * - Threshold trips by phase
 * - Per-run totals
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    /**
     * Record a status query, batch or single
     */
    public void recordStatusQuery(String mode, boolean success) {
        meterRegistry.counter("litigation_hold_status_queries",
                "mode", mode,
                "success", String.valueOf(success)
        ).increment();
    }

    /**
     * Record a batch degraded to single queries
     */
    public void recordStatusFallback() {
        meterRegistry.counter("litigation_hold_status_fallbacks").increment();
    }

    /**
     * Create a timer for a hold update
     */
    public Timer.Sample startMutationTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record hold update time and result
     */
    public void recordMutation(Timer.Sample sample, boolean success) {
        sample.stop(Timer.builder("litigation_hold_mutation_time")
                .tag("success", String.valueOf(success))
                .description("Litigation hold update time")
                .register(meterRegistry));
    }

    /**
     * Record a run halted by the error threshold
     */
    public void recordThresholdExceeded(RunPhase phase) {
        meterRegistry.counter("litigation_hold_threshold_exceeded",
                "phase", phase.name().toLowerCase()
        ).increment();
    }

    /**
     * Record the totals of a finished run
     */
    public void recordRunSummary(RunSummary summary) {
        var mode = summary.isPreview() ? "preview" : "live";
        meterRegistry.counter("litigation_hold_runs", "mode", mode, "halted", String.valueOf(summary.isHalted())).increment();
        meterRegistry.counter("litigation_hold_subjects", "mode", mode, "action", "already_compliant").increment(summary.getAlreadyCompliant());
        meterRegistry.counter("litigation_hold_subjects", "mode", mode, "action", "enabled").increment(summary.getNewlyEnabled());
        meterRegistry.counter("litigation_hold_subjects", "mode", mode, "action", "failed").increment(summary.getFailed());
        meterRegistry.counter("litigation_hold_subjects", "mode", mode, "action", "no_target_resource").increment(summary.getNoTargetResource());
    }
}
