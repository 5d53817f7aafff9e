package com.example.litigationhold.service.planning;

import com.example.litigationhold.domain.enums.ScaleTier;
import com.example.litigationhold.dto.BulkOperationPlan;
import com.example.litigationhold.dto.ResourceHints;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Derives batch and concurrency settings from the environment size and host resources.
 * <p>
 * Base values come from the {@link ScaleTier} ladder; memory and bandwidth modifiers are
 * then applied in that order, each on the output of the previous step.
 */
@Slf4j
@Component
public class ConfigurationAdvisor {

    static final int LOW_MEMORY_MB = 2048;
    static final int HIGH_MEMORY_MB = 8192;
    static final int LOW_BANDWIDTH_MBPS = 50;

    static final int MIN_BATCH_SIZE = 50;
    static final int MAX_BATCH_SIZE = 2000;
    static final int MIN_CONCURRENCY = 2;
    static final int MAX_CONCURRENCY = 25;

    static final long LOW_BANDWIDTH_THROTTLE_MS = 500;

    /**
     * Advise settings for a run.
     *
     * @param totalSubjects Number of subjects the run will process
     * @param hints         Host resource hints
     * @return The advised plan; never null
     */
    public BulkOperationPlan advise(long totalSubjects, ResourceHints hints) {
        var tier = ScaleTier.forSubjectCount(totalSubjects);
        var warnings = new ArrayList<String>();

        var batchSize = tier.getBatchSize();
        var concurrency = tier.getConcurrencyLimit();
        long throttleDelayMs = 0;

        if (tier.getWarning() != null) {
            warnings.add(tier.getWarning());
        }

        if (hints.getAvailableMemoryMb() < LOW_MEMORY_MB) {
            batchSize = Math.max(MIN_BATCH_SIZE, (int) Math.floor(batchSize * 0.5));
            concurrency = Math.max(MIN_CONCURRENCY, (int) Math.floor(concurrency * 0.5));
            warnings.add(String.format("Low memory (%d MB): batch size and concurrency halved", hints.getAvailableMemoryMb()));
        } else if (hints.getAvailableMemoryMb() > HIGH_MEMORY_MB) {
            batchSize = Math.min(MAX_BATCH_SIZE, (int) Math.floor(batchSize * 1.5));
            concurrency = Math.min(MAX_CONCURRENCY, (int) Math.floor(concurrency * 1.5));
        }

        if (hints.getBandwidthMbps() < LOW_BANDWIDTH_MBPS) {
            throttleDelayMs = LOW_BANDWIDTH_THROTTLE_MS;
            concurrency = Math.max(MIN_CONCURRENCY, (int) Math.floor(concurrency * 0.7));
            warnings.add(String.format("Low bandwidth (%d Mbps): throttling %d ms between batches and reducing concurrency",
                    hints.getBandwidthMbps(), LOW_BANDWIDTH_THROTTLE_MS));
        }

        var plan = BulkOperationPlan.builder()
                .tier(tier)
                .batchSize(batchSize)
                .concurrencyLimit(concurrency)
                .cleanupInterval(tier.getCleanupInterval())
                .throttleDelayMs(throttleDelayMs)
                .recommendedWindow(tier.getRecommendedWindow())
                .warnings(warnings)
                .build();

        log.debug("Advised plan for {} subjects ({}): {}", totalSubjects, tier, plan);
        return plan;
    }

    /**
     * Replace advised values by explicit settings where given
     *
     * @param plan             Advised plan
     * @param batchSize        Explicit batch size, or null
     * @param concurrencyLimit Explicit concurrency limit, or null
     * @return A new plan with the overrides applied
     */
    public BulkOperationPlan applyOverrides(BulkOperationPlan plan, Integer batchSize, Integer concurrencyLimit) {
        var builder = plan.toBuilder().warnings(new ArrayList<>(plan.getWarnings()));

        if (batchSize != null && batchSize != plan.getBatchSize()) {
            log.info("Batch size override: {} (advised {})", batchSize, plan.getBatchSize());
            builder.batchSize(batchSize);
        }
        if (concurrencyLimit != null && concurrencyLimit != plan.getConcurrencyLimit()) {
            log.info("Concurrency limit override: {} (advised {})", concurrencyLimit, plan.getConcurrencyLimit());
            builder.concurrencyLimit(concurrencyLimit);
        }

        return builder.build();
    }
}
