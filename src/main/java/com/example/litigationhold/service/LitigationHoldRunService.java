package com.example.litigationhold.service;

import com.example.litigationhold.client.MailboxStatusClient;
import com.example.litigationhold.config.DirectoryServiceProperties;
import com.example.litigationhold.config.LitigationHoldProperties;
import com.example.litigationhold.config.MailboxServiceProperties;
import com.example.litigationhold.config.MetricsConfig;
import com.example.litigationhold.domain.model.StatusRecord;
import com.example.litigationhold.domain.model.Subject;
import com.example.litigationhold.dto.BulkOperationPlan;
import com.example.litigationhold.dto.DiscoveryResult;
import com.example.litigationhold.dto.ResourceHints;
import com.example.litigationhold.dto.RunReport;
import com.example.litigationhold.exception.ExternalServiceException;
import com.example.litigationhold.exception.PreconditionFailedException;
import com.example.litigationhold.exception.ThresholdExceededException;
import com.example.litigationhold.service.alert.SlackAlertService;
import com.example.litigationhold.service.directory.SubjectDirectoryService;
import com.example.litigationhold.service.license.LicenseEligibilityTable;
import com.example.litigationhold.service.license.LicenseTableLoader;
import com.example.litigationhold.service.mutation.BulkMutator;
import com.example.litigationhold.service.planning.ConfigurationAdvisor;
import com.example.litigationhold.service.report.ReportAggregator;
import com.example.litigationhold.service.report.ReportWriter;
import com.example.litigationhold.service.run.RunContext;
import com.example.litigationhold.service.status.StatusReconciler;
import com.example.litigationhold.service.threshold.ErrorThresholdMonitor;
import com.example.litigationhold.service.threshold.RunCounters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Runs one litigation hold enforcement pass end to end.
 * <p>
 * Phases: preconditions, discovery, planning, status reconciliation, hold updates, reporting.
 * A threshold halt or an unexpected error while processing stops the remaining batches, but
 * the report is still produced from what was recorded and the run is marked halted.
 * Precondition failures abort before any subject is touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LitigationHoldRunService {

    private static final String MDC_RUN_ID = "runId";

    private final LitigationHoldProperties properties;
    private final DirectoryServiceProperties directoryProperties;
    private final MailboxServiceProperties mailboxProperties;
    private final MailboxStatusClient mailboxStatusClient;
    private final SubjectDirectoryService subjectDirectoryService;
    private final LicenseTableLoader licenseTableLoader;
    private final ConfigurationAdvisor configurationAdvisor;
    private final StatusReconciler statusReconciler;
    private final BulkMutator bulkMutator;
    private final ReportAggregator reportAggregator;
    private final ReportWriter reportWriter;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;

    /**
     * Execute a run
     *
     * @return Rows and summary of the run, halted or not
     * @throws PreconditionFailedException if credentials are missing or a service is unreachable
     */
    public RunReport execute() {
        var runId = UUID.randomUUID().toString();
        var startedAt = Instant.now();
        MDC.put(MDC_RUN_ID, runId);

        try {
            log.info("Starting litigation hold run {} in {} mode", runId, properties.isPreview() ? "PREVIEW" : "LIVE");

            checkPreconditions();

            var table = licenseTableLoader.load(properties.getLicenseTablePath());
            var discovery = discover(table);
            var subjects = discovery.getEligibleSubjects();

            var plan = plan(subjects.size());

            var counters = new RunCounters();
            counters.addEligible(subjects.size());
            counters.addSkipped(discovery.getSkipped());
            var monitor = new ErrorThresholdMonitor(counters, properties.getMaxErrors(), properties.isContinueOnErrors());
            var context = new RunContext(runId, startedAt, properties.isPreview(), plan, counters, monitor);

            process(subjects, context);

            return finish(subjects, context, discovery);
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    void checkPreconditions() {
        if (isBlank(directoryProperties.getAccessToken())) {
            throw new PreconditionFailedException("Directory Service", "access token is not configured");
        }
        if (isBlank(mailboxProperties.getAccessToken())) {
            throw new PreconditionFailedException("Mailbox Service", "access token is not configured");
        }

        try {
            var session = mailboxStatusClient.verifySession();
            log.info("Mailbox service session verified (tenant: {}, principal: {})", session.getTenant(), session.getPrincipal());
        } catch (ExternalServiceException e) {
            var reason = e.isAuthenticationFailure() ? "credentials rejected" : "service unreachable";
            throw new PreconditionFailedException("Mailbox Service", reason + ": " + e.getMessage(), e);
        }
    }

    private DiscoveryResult discover(LicenseEligibilityTable table) {
        try {
            return subjectDirectoryService.discover(table);
        } catch (ExternalServiceException e) {
            throw new PreconditionFailedException("Directory Service", "subject discovery failed: " + e.getMessage(), e);
        }
    }

    private BulkOperationPlan plan(int subjectCount) {
        var hints = new ResourceHints(properties.getMemoryHintMb(), properties.getBandwidthHintMbps());
        var plan = configurationAdvisor.applyOverrides(
                configurationAdvisor.advise(subjectCount, hints),
                properties.getBatchSize(),
                properties.getConcurrencyLimit());

        log.info("Plan for {} subjects: tier={}, batchSize={}, concurrency={}, throttle={}ms, cleanupInterval={}, window='{}'",
                subjectCount, plan.getTier(), plan.getBatchSize(), plan.getConcurrencyLimit(),
                plan.getThrottleDelayMs(), plan.getCleanupInterval(), plan.getRecommendedWindow());
        plan.getWarnings().forEach(warning -> log.warn("Plan warning: {}", warning));
        if (properties.isContinueOnErrors()) {
            log.warn("continue-on-errors is set, the run will not halt on errors (max-errors {} is informational only)",
                    properties.getMaxErrors());
        }
        return plan;
    }

    private void process(List<Subject> subjects, RunContext context) {
        try {
            statusReconciler.reconcile(subjects, context);

            var targets = subjects.stream()
                    .filter(subject -> context.getStatus(subject.getIdentity())
                            .map(StatusRecord::requiresAction)
                            .orElse(false))
                    .toList();
            log.info("{} of {} subjects require a litigation hold", targets.size(), subjects.size());

            bulkMutator.mutate(targets, context);
        } catch (ThresholdExceededException e) {
            log.error("Run {} halted: {}", context.getRunId(), e.getMessage());
            context.halt(e.getMessage());
            metricsConfig.recordThresholdExceeded(e.getPhase());
        } catch (RuntimeException e) {
            log.error("Run {} aborted by an unexpected error: {}", context.getRunId(), e.getMessage(), e);
            context.halt("Run aborted by an unexpected error: " + e.getMessage());
        }
    }

    private RunReport finish(List<Subject> subjects, RunContext context, DiscoveryResult discovery) {
        var report = reportAggregator.aggregate(subjects, context, discovery, Instant.now());
        var summary = report.getSummary();

        log.info("Run {} finished in {}: eligible={}, alreadyCompliant={}, {}={}, failed={}, noMailbox={}, errors={}, halted={}",
                summary.getRunId(), summary.getElapsed(), summary.getTotalEligible(), summary.getAlreadyCompliant(),
                summary.isPreview() ? "wouldEnable" : "enabled", summary.getNewlyEnabled(), summary.getFailed(),
                summary.getNoTargetResource(), summary.getTotalErrors(), summary.isHalted());

        if (properties.getReport().isEnabled()) {
            try {
                reportWriter.write(report);
            } catch (IOException e) {
                log.error("Failed to write report for run {}: {}", summary.getRunId(), e.getMessage(), e);
            }
        }

        metricsConfig.recordRunSummary(summary);

        if (summary.isHalted()) {
            slackAlertService.sendRunHaltedAlert(summary);
        } else if (summary.getFailed() > 0) {
            slackAlertService.sendRunCompletedWithFailuresAlert(summary);
        }

        return report;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
