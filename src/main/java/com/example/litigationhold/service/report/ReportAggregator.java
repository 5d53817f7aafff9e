package com.example.litigationhold.service.report;

import com.example.litigationhold.domain.enums.HoldAction;
import com.example.litigationhold.domain.model.Subject;
import com.example.litigationhold.dto.DiscoveryResult;
import com.example.litigationhold.dto.RunReport;
import com.example.litigationhold.dto.RunSummary;
import com.example.litigationhold.dto.SubjectReportRow;
import com.example.litigationhold.service.run.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Joins reconciled statuses with mutation outcomes into one row per subject and a run summary.
 * <p>
 * Classification is evaluated in {@link HoldAction} declaration order and the first match wins,
 * so every subject gets exactly one action.
 */
@Slf4j
@Component
public class ReportAggregator {

    static final String HALTED_NOTE = "Run halted before this subject was processed";

    /**
     * Build the report of a run.
     *
     * @param subjects   Subjects that entered the run, in order
     * @param context    The run
     * @param discovery  Discovery counts
     * @param finishedAt End of the run
     * @return Rows in subject order and the summary
     */
    public RunReport aggregate(List<Subject> subjects, RunContext context, DiscoveryResult discovery, Instant finishedAt) {
        var rows = new ArrayList<SubjectReportRow>(subjects.size());
        var counts = new EnumMap<HoldAction, Long>(HoldAction.class);

        for (var subject : subjects) {
            var action = classify(subject, context);
            counts.merge(action, 1L, Long::sum);
            rows.add(toRow(subject, action, context));
        }

        var summary = RunSummary.builder()
                .runId(context.getRunId())
                .preview(context.isPreview())
                .totalDiscovered(discovery.getTotalDiscovered())
                .skipped(context.getCounters().getSkipped())
                .totalEligible(subjects.size())
                .alreadyCompliant(count(counts, HoldAction.ALREADY_COMPLIANT))
                .newlyEnabled(count(counts, HoldAction.ENABLED) + count(counts, HoldAction.PREVIEW_WOULD_ENABLE))
                .failed(count(counts, HoldAction.FAILED))
                .noTargetResource(count(counts, HoldAction.NO_TARGET_RESOURCE))
                .noActionRequired(count(counts, HoldAction.NO_ACTION_REQUIRED))
                .totalErrors(context.getCounters().getErrors())
                .halted(context.isHalted())
                .haltReason(context.getHaltReason())
                .startedAt(context.getStartedAt())
                .finishedAt(finishedAt)
                .elapsed(Duration.between(context.getStartedAt(), finishedAt))
                .plan(context.getPlan())
                .build();

        log.debug("Report aggregated for {} subjects: {}", subjects.size(), counts);
        return RunReport.builder().rows(rows).summary(summary).build();
    }

    /**
     * Decide the action of one subject
     */
    public HoldAction classify(Subject subject, RunContext context) {
        var identity = subject.getIdentity();
        var status = context.getStatus(identity);

        if (status.isPresent() && status.get().isComplianceEnabled()) {
            return HoldAction.ALREADY_COMPLIANT;
        }
        if (status.isPresent() && !status.get().isHasTargetResource()) {
            return HoldAction.NO_TARGET_RESOURCE;
        }

        var outcome = context.getOutcome(identity);
        if (outcome.isPresent()) {
            if (outcome.get().isPreview()) {
                return HoldAction.PREVIEW_WOULD_ENABLE;
            }
            return outcome.get().isSuccess() ? HoldAction.ENABLED : HoldAction.FAILED;
        }
        return HoldAction.NO_ACTION_REQUIRED;
    }

    private SubjectReportRow toRow(Subject subject, HoldAction action, RunContext context) {
        var identity = subject.getIdentity();
        var status = context.getStatus(identity).orElse(null);
        var outcome = context.getOutcome(identity).orElse(null);

        var row = SubjectReportRow.builder()
                .identity(identity)
                .displayName(subject.getDisplayName())
                .accountEnabled(subject.isEnabled())
                .licenses(String.join(";", subject.getLicenses().stream().sorted().toList()))
                .action(action);

        if (status != null) {
            row.holdEnabled(status.isComplianceEnabled())
                    .holdDate(status.getEnabledDate())
                    .holdOwner(status.getOwner())
                    .hasMailbox(status.isHasTargetResource());
        }

        if (outcome != null) {
            row.error(outcome.getErrorMessage()).timestamp(outcome.getTimestamp());
        } else {
            context.getStatusError(identity).ifPresent(row::error);
        }

        if (action == HoldAction.NO_ACTION_REQUIRED && context.isHalted()) {
            row.note(HALTED_NOTE);
        } else if (action == HoldAction.PREVIEW_WOULD_ENABLE) {
            row.note("Preview only, no change made");
        }

        return row.build();
    }

    private static long count(Map<HoldAction, Long> counts, HoldAction action) {
        return counts.getOrDefault(action, 0L);
    }
}
