package com.example.fieldtasks.service.notification;

import com.example.fieldtasks.config.MetricsConfig;
import com.example.fieldtasks.config.SlackProperties;
import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.domain.enums.TaskStatus;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Push channel: posts status changes and deadline alerts to the team's Slack channel,
 * where admins follow the board.
 */
@Slf4j
@Service
public class SlackNotificationService {

    static final String CHANNEL = "slack";

    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final SlackProperties slackProperties;
    private final MetricsConfig metricsConfig;
    private final Slack slack;

    @Value("${spring.application.name:field-task-tracker}")
    private String applicationName = "field-task-tracker";

    @Autowired
    public SlackNotificationService(SlackProperties slackProperties, MetricsConfig metricsConfig) {
        this(slackProperties, metricsConfig, Slack.getInstance());
    }

    SlackNotificationService(SlackProperties slackProperties, MetricsConfig metricsConfig, Slack slack) {
        this.slackProperties = slackProperties;
        this.metricsConfig = metricsConfig;
        this.slack = slack;
    }

    /**
     * Announce a status change.
     *
     * @param assigneeLabel friendly name of the assignee, or the user id
     * @return true if Slack accepted the message
     */
    public boolean sendStatusChange(FieldTask task, TaskStatus oldStatus, String updatedBy, String assigneeLabel) {
        var text = String.format("Task Update: '%s' (ID: %s) status changed from '%s' to '%s' by user %s.",
                task.getTitle(), task.getId(), oldStatus.getCode(), task.getStatus().getCode(), updatedBy);

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":clipboard:")
                .text(":clipboard: *Task Status Updated: " + truncate(task.getTitle(), 50) + "*")
                .attachments(List.of(
                        Attachment.builder()
                                .color(task.getStatus().isCompleted() ? "good" : "#439FE0")
                                .title(task.getTitle())
                                .titleLink(buildTaskLink(task))
                                .text(text)
                                .fields(Arrays.asList(
                                        field("From", oldStatus.getDisplayName(), true),
                                        field("To", task.getStatus().getDisplayName(), true),
                                        field("Updated By", updatedBy, true),
                                        field("Assigned To", assigneeLabel, true)
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        return send(payload, "status-change", task);
    }

    /**
     * Alert the channel that a task is close to (or past) its deadline.
     *
     * @return true if Slack accepted the message
     */
    public boolean sendDeadlineAlert(FieldTask task, String assigneeLabel) {
        var overdue = task.getDeadline().isBefore(Instant.now());

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":alarm_clock:")
                .text(String.format(":alarm_clock: *Task '%s' assigned to %s is %s its deadline.*",
                        truncate(task.getTitle(), 80), assigneeLabel, overdue ? "past" : "nearing"))
                .attachments(List.of(
                        Attachment.builder()
                                .color(overdue ? "danger" : "warning")
                                .title(task.getTitle())
                                .titleLink(buildTaskLink(task))
                                .fields(Arrays.asList(
                                        field("Task ID", task.getId().toString(), true),
                                        field("Status", task.getStatus().getDisplayName(), true),
                                        field("Assigned To", assigneeLabel, true),
                                        field("Deadline", DATE_FORMATTER.format(task.getDeadline()), true)
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        return send(payload, "deadline", task);
    }

    private boolean send(Payload payload, String type, FieldTask task) {
        if (!slackProperties.isConfigured()) {
            log.info("Slack is disabled or webhook URL not configured. Skipping {} notification for task {}.", type, task.getId());
            return false;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack {} notification for task {}. Response code: {}, body: {}",
                        type, task.getId(), response.getCode(), response.getBody());
                metricsConfig.recordNotification(CHANNEL, type, false);
                return false;
            }

            log.info("Slack {} notification sent for task {}", type, task.getId());
            metricsConfig.recordNotification(CHANNEL, type, true);
            return true;
        } catch (Exception e) {
            log.error("Error sending Slack {} notification for task {}: {}", type, task.getId(), e.getMessage(), e);
            metricsConfig.recordNotification(CHANNEL, type, false);
            return false;
        }
    }

    private static Field field(String title, String value, boolean valueShortEnough) {
        return Field.builder()
                .title(title)
                .value(value)
                .valueShortEnough(valueShortEnough)
                .build();
    }

    private String buildTaskLink(FieldTask task) {
        return slackProperties.getDashboardBaseUrl() + "/tasks/" + task.getId();
    }

    private static String truncate(String text, int maxLength) {
        return EmailNotificationService.truncate(text, maxLength);
    }
}
