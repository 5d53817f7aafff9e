package com.example.litigationhold.service.mutation;

import com.example.litigationhold.client.ClientModels.LitigationHoldRequest;
import com.example.litigationhold.client.MailboxStatusClient;
import com.example.litigationhold.config.LitigationHoldProperties;
import com.example.litigationhold.config.MetricsConfig;
import com.example.litigationhold.domain.enums.RunPhase;
import com.example.litigationhold.domain.model.Batch;
import com.example.litigationhold.domain.model.OperationOutcome;
import com.example.litigationhold.domain.model.Subject;
import com.example.litigationhold.service.batch.BatchIterator;
import com.example.litigationhold.service.run.MemoryCleanup;
import com.example.litigationhold.service.run.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Enables litigation hold on every subject that needs it.
 * <p>
 * Subjects are processed in sub-batches of at most 100. In live mode each subject gets
 * one task on the mutation pool; a semaphore sized to the run's concurrency limit admits
 * tasks, so the coordinator blocks while the limit is reached. All tasks of a sub-batch
 * finish before the error threshold is checked and the next sub-batch starts.
 * Tasks already running are never cancelled.
 * <p>
 * In preview mode no call is made and every subject gets a simulated success.
 */
@Slf4j
@Service
public class BulkMutator {

    private final MailboxStatusClient mailboxStatusClient;
    private final MetricsConfig metricsConfig;
    private final LitigationHoldProperties properties;
    private final ExecutorService mutationExecutor;

    public BulkMutator(MailboxStatusClient mailboxStatusClient, MetricsConfig metricsConfig, LitigationHoldProperties properties,
                       @Qualifier("mutationExecutor") ExecutorService mutationExecutor) {
        this.mailboxStatusClient = mailboxStatusClient;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.mutationExecutor = mutationExecutor;
    }

    /**
     * Apply (or simulate) the hold on each target.
     *
     * @param targets Reconciled subjects with a mailbox and no hold
     * @param context The run
     * @throws com.example.litigationhold.exception.ThresholdExceededException if the run must halt
     */
    public void mutate(List<Subject> targets, RunContext context) {
        if (targets.isEmpty()) {
            log.info("No mailbox requires litigation hold");
            return;
        }

        var plan = context.getPlan();
        var batches = BatchIterator.of(targets, plan.getMutationBatchSize());
        var admission = new Semaphore(plan.getConcurrencyLimit());

        log.info("{} litigation hold on {} mailboxes in {} batches of up to {} (concurrency {})",
                context.isPreview() ? "Previewing" : "Enabling",
                targets.size(), batches.batchCount(), plan.getMutationBatchSize(), plan.getConcurrencyLimit());

        for (var batch : batches) {
            if (context.isPreview()) {
                previewBatch(batch, context);
            } else {
                executeBatch(batch, admission, context);
            }

            log.info("Hold batch {}/{} done: {} enabled, {} errors so far",
                    batch.getIndex(), batch.getTotalBatches(),
                    context.getCounters().getNewlyCompliant(), context.getCounters().getErrors());

            MemoryCleanup.runIfDue(batch.getIndex(), plan.getCleanupInterval());
            context.getThresholdMonitor().checkpoint(RunPhase.MUTATION, batch.getIndex());

            if (!context.isPreview() && !batch.isLast()) {
                throttle(plan.getThrottleDelayMs());
            }
        }
    }

    private void previewBatch(Batch<Subject> batch, RunContext context) {
        for (var subject : batch.getItems()) {
            log.debug("[PREVIEW] Would enable litigation hold for {}", subject.getIdentity());
            context.recordOutcome(OperationOutcome.preview(subject.getIdentity()));
            context.getCounters().incrementNewlyCompliant();
        }
    }

    private void executeBatch(Batch<Subject> batch, Semaphore admission, RunContext context) {
        var futures = new ArrayList<CompletableFuture<Void>>(batch.size());
        var logContext = MDC.getCopyOfContextMap();
        InterruptedException interruption = null;

        for (var subject : batch.getItems()) {
            try {
                admission.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interruption = e;
                break;
            }

            try {
                futures.add(CompletableFuture.runAsync(() -> {
                    if (logContext != null) {
                        MDC.setContextMap(logContext);
                    }
                    try {
                        applyHold(subject, admission, context);
                    } finally {
                        MDC.clear();
                    }
                }, mutationExecutor));
            } catch (RejectedExecutionException e) {
                admission.release();
                recordFailure(subject.getIdentity(), "Worker pool rejected the task: " + e.getMessage(), context);
            }
        }

        // Barrier: every admitted task of this batch completes before we go on
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        if (interruption != null) {
            throw new IllegalStateException("Interrupted while waiting for a worker slot in batch " + batch.getIndex(), interruption);
        }
    }

    private void applyHold(Subject subject, Semaphore admission, RunContext context) {
        var identity = subject.getIdentity();
        var sample = metricsConfig.startMutationTimer();
        var success = false;

        try {
            var response = mailboxStatusClient.enableLitigationHold(identity, buildRequest());

            if (response != null && !response.isLitigationHoldEnabled()) {
                var message = response.getMessage() != null ? response.getMessage() : "no reason given";
                recordFailure(identity, "Service did not enable the hold: " + message, context);
            } else {
                log.info("Litigation hold enabled for {}", identity);
                context.recordOutcome(OperationOutcome.success(identity));
                context.getCounters().incrementNewlyCompliant();
                success = true;
            }
        } catch (Exception e) {
            log.warn("Failed to enable litigation hold for {}: {}", identity, e.getMessage());
            recordFailure(identity, e.getMessage(), context);
        } finally {
            metricsConfig.recordMutation(sample, success);
            admission.release();
        }
    }

    private void recordFailure(String identity, String errorMessage, RunContext context) {
        context.recordOutcome(OperationOutcome.failure(identity, errorMessage));
        context.getThresholdMonitor().recordError(identity, "Hold update failed: " + errorMessage);
    }

    private LitigationHoldRequest buildRequest() {
        return LitigationHoldRequest.builder()
                .enabled(true)
                .durationDays(properties.getHoldDurationDays())
                .owner(properties.getHoldOwner())
                .build();
    }

    private void throttle(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Throttle pause interrupted");
        }
    }
}
