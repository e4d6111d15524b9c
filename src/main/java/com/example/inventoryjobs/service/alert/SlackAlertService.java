package com.example.inventoryjobs.service.alert;

import com.example.inventoryjobs.config.SlackProperties;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Service for sending alerts to Slack when tasks are dead-lettered.
 * <p>
 * Alerts are best effort: a Slack outage is logged and never affects task processing.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:inventory-jobs}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert for a dead-lettered task.
     * Runs asynchronously to not block task processing.
     */
    @Async
    public void sendDeadLetterAlert(QueuedTask task) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Task {} was dead-lettered but no alert was sent.", task.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildDeadLetterPayload(task));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for dead-lettered task {}", task.getId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for task {}: {}", task.getId(), e.getMessage(), e);
        }
    }

    Payload buildDeadLetterPayload(QueuedTask task) {
        var taskId = task.getId().toString();
        var lastError = task.getLastError() != null ? task.getLastError() : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Task Dead-Lettered - Manual Intervention Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(task.getTaskType() + " on queue " + task.getQueue())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/tasks/" + taskId)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Task ID")
                                                .value(taskId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Task Type")
                                                .value(task.getTaskType())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Attempts")
                                                .value(String.valueOf(task.getRetryCount() + 1))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Created At")
                                                .value(task.getCreatedAt() != null ? DATE_FORMATTER.format(task.getCreatedAt()) : "n/a")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Please investigate and requeue or discard")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
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
