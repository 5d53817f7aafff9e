package com.example.litigationhold.service.alert;

import com.example.litigationhold.config.SlackProperties;
import com.example.litigationhold.dto.RunSummary;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for sending run alerts to Slack.
 * <p>
 * Posts to the compliance channel when a run halts or finishes with failed subjects,
 * so the remaining mailboxes can be picked up by a follow-up run. Alerting never fails a run.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:litigation-hold-enforcer}")
    private String applicationName = "litigation-hold-enforcer";

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert that a run stopped before every subject was processed
     *
     * @return true if the alert was delivered
     */
    public boolean sendRunHaltedAlert(RunSummary summary) {
        return send(summary, ":rotating_light:", "danger",
                ":rotating_light: *Litigation Hold Run Halted - Manual Intervention Required*",
                summary.getHaltReason());
    }

    /**
     * Alert that a run completed but some subjects could not be placed on hold
     *
     * @return true if the alert was delivered
     */
    public boolean sendRunCompletedWithFailuresAlert(RunSummary summary) {
        return send(summary, ":warning:", "warning",
                ":warning: *Litigation Hold Run Completed With Failures*",
                summary.getFailed() + " subject(s) could not be placed on hold");
    }

    private boolean send(RunSummary summary, String icon, String color, String text, String detail) {
        if (!slackProperties.isUsable()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Alert for run {} not sent.", summary.getRunId());
            return false;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(icon)
                    .text(text)
                    .attachments(List.of(
                            Attachment.builder()
                                    .color(color)
                                    .title("Run " + summary.getRunId() + (summary.isPreview() ? " (preview)" : ""))
                                    .text(truncate(detail, 500))
                                    .fields(buildFields(summary))
                                    .footer(applicationName + " | See the run report for per-subject detail")
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
                return false;
            }
            log.info("Slack alert sent for run {}", summary.getRunId());
            return true;
        } catch (Exception e) {
            log.error("Error sending Slack alert for run {}: {}", summary.getRunId(), e.getMessage(), e);
            return false;
        }
    }

    private List<Field> buildFields(RunSummary summary) {
        var fields = new ArrayList<Field>();
        fields.add(shortField("Eligible", summary.getTotalEligible()));
        fields.add(shortField("Already compliant", summary.getAlreadyCompliant()));
        fields.add(shortField(summary.isPreview() ? "Would enable" : "Enabled", summary.getNewlyEnabled()));
        fields.add(shortField("Failed", summary.getFailed()));
        fields.add(shortField("No mailbox", summary.getNoTargetResource()));
        fields.add(shortField("Errors", summary.getTotalErrors()));
        if (summary.getStartedAt() != null) {
            fields.add(Field.builder()
                    .title("Started At")
                    .value(DATE_FORMATTER.format(summary.getStartedAt()))
                    .valueShortEnough(true)
                    .build());
        }
        return fields;
    }

    private Field shortField(String title, long value) {
        return Field.builder()
                .title(title)
                .value(String.valueOf(value))
                .valueShortEnough(true)
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
