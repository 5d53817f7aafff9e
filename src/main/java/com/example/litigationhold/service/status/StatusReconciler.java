package com.example.litigationhold.service.status;

import com.example.litigationhold.client.ClientModels.MailboxHoldStatus;
import com.example.litigationhold.client.MailboxStatusClient;
import com.example.litigationhold.config.MetricsConfig;
import com.example.litigationhold.domain.enums.RunPhase;
import com.example.litigationhold.domain.model.Batch;
import com.example.litigationhold.domain.model.StatusRecord;
import com.example.litigationhold.domain.model.Subject;
import com.example.litigationhold.service.batch.BatchIterator;
import com.example.litigationhold.service.run.MemoryCleanup;
import com.example.litigationhold.service.run.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the current litigation hold status of every subject, batch by batch.
 * <p>
 * Each batch is first queried in one call. If that call fails the batch falls back to
 * one query per subject; a subject whose own query fails counts as an error and is
 * treated as having no mailbox. The error threshold is checked after every batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusReconciler {

    private final MailboxStatusClient mailboxStatusClient;
    private final MetricsConfig metricsConfig;

    /**
     * Attach a status to each subject in the context, in input order.
     *
     * @param subjects Eligible subjects
     * @param context  The run
     * @throws com.example.litigationhold.exception.ThresholdExceededException if the run must halt
     */
    public void reconcile(List<Subject> subjects, RunContext context) {
        var plan = context.getPlan();
        var batches = BatchIterator.of(subjects, plan.getBatchSize());
        var total = subjects.size();

        log.info("Reconciling litigation hold status of {} subjects in {} batches of up to {}",
                total, batches.batchCount(), plan.getBatchSize());

        for (var batch : batches) {
            var lookup = resolveBatch(batch, context);

            for (var subject : batch.getItems()) {
                var status = lookup.getOrDefault(RunContext.key(subject.getIdentity()), StatusRecord.noTargetResource());
                context.recordStatus(subject.getIdentity(), status);
                if (status.isComplianceEnabled()) {
                    context.getCounters().incrementAlreadyCompliant();
                }
            }

            var processed = context.getCounters().addProcessed(batch.size());
            log.info("Status batch {}/{} done: {}/{} subjects ({}%)",
                    batch.getIndex(), batch.getTotalBatches(), processed, total, percent(processed, total));

            MemoryCleanup.runIfDue(batch.getIndex(), plan.getCleanupInterval());
            context.getThresholdMonitor().checkpoint(RunPhase.RECONCILIATION, batch.getIndex());
        }
    }

    private Map<String, StatusRecord> resolveBatch(Batch<Subject> batch, RunContext context) {
        var identities = batch.getItems().stream().map(Subject::getIdentity).toList();

        try {
            var results = mailboxStatusClient.queryStatuses(identities);
            metricsConfig.recordStatusQuery("batch", true);

            var lookup = new HashMap<String, StatusRecord>();
            for (var result : results) {
                if (result.getIdentity() != null) {
                    lookup.put(RunContext.key(result.getIdentity()), toStatusRecord(result));
                }
            }
            return lookup;
        } catch (Exception e) {
            metricsConfig.recordStatusQuery("batch", false);
            metricsConfig.recordStatusFallback();
            log.warn("Status query for batch {}/{} ({} subjects) failed, querying one by one: {}",
                    batch.getIndex(), batch.getTotalBatches(), batch.size(), e.getMessage());
            return resolveIndividually(batch, context);
        }
    }

    private Map<String, StatusRecord> resolveIndividually(Batch<Subject> batch, RunContext context) {
        var lookup = new HashMap<String, StatusRecord>();

        for (var subject : batch.getItems()) {
            var identity = subject.getIdentity();
            try {
                mailboxStatusClient.getStatus(identity)
                        .ifPresent(result -> lookup.put(RunContext.key(identity), toStatusRecord(result)));
                metricsConfig.recordStatusQuery("single", true);
            } catch (Exception e) {
                metricsConfig.recordStatusQuery("single", false);
                log.warn("Status query failed for {}: {}", identity, e.getMessage());

                context.getThresholdMonitor().recordError(identity, "Status query failed: " + e.getMessage());
                context.recordStatusError(identity, e.getMessage());
                lookup.put(RunContext.key(identity), StatusRecord.noTargetResource());
            }
        }
        return lookup;
    }

    private StatusRecord toStatusRecord(MailboxHoldStatus result) {
        return StatusRecord.builder()
                .complianceEnabled(result.isLitigationHoldEnabled())
                .enabledDate(result.getLitigationHoldDate())
                .owner(result.getLitigationHoldOwner())
                .hasTargetResource(true)
                .build();
    }

    private static long percent(long part, long total) {
        return total == 0 ? 100 : part * 100 / total;
    }
}
