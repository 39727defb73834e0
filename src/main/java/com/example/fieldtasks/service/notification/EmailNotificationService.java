package com.example.fieldtasks.service.notification;

import com.example.fieldtasks.config.EmailProperties;
import com.example.fieldtasks.config.MetricsConfig;
import com.example.fieldtasks.domain.entity.FieldTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Email channel: assignment notices and deadline reminders to the assignee.
 * <p>
 * Skipped with a log line when no sender address or no mail server is configured.
 */
@Slf4j
@Service
public class EmailNotificationService {

    static final String CHANNEL = "email";

    private static final DateTimeFormatter DEADLINE_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final EmailProperties emailProperties;
    private final MetricsConfig metricsConfig;

    public EmailNotificationService(ObjectProvider<JavaMailSender> mailSenderProvider,
                                    EmailProperties emailProperties,
                                    MetricsConfig metricsConfig) {
        this.mailSenderProvider = mailSenderProvider;
        this.emailProperties = emailProperties;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Tell a member that a task has been assigned to them.
     *
     * @return true if the message was handed to the mail server
     */
    public boolean sendAssignmentEmail(String recipientEmail, String username, FieldTask task) {
        var body = String.format("""
                        Hello %s,

                        A new task '%s' has been assigned to you.
                        %s
                        Deadline: %s

                        Thank you.""",
                displayName(username), task.getTitle(), descriptionLine(task), DEADLINE_FORMATTER.format(task.getDeadline()));

        return send(recipientEmail, "New Task Assigned to You", body, "assignment");
    }

    /**
     * Remind the assignee that a deadline is close.
     *
     * @return true if the message was handed to the mail server
     */
    public boolean sendDeadlineReminder(String recipientEmail, String username, FieldTask task) {
        var body = String.format("""
                        Hello %s,

                        Your task '%s' is nearing its deadline.
                        Status: %s
                        Deadline: %s

                        Thank you.""",
                displayName(username), task.getTitle(), task.getStatus().getDisplayName(),
                DEADLINE_FORMATTER.format(task.getDeadline()));

        return send(recipientEmail, "Task Deadline Approaching: " + truncate(task.getTitle(), 50), body, "deadline");
    }

    private boolean send(String recipientEmail, String subject, String body, String type) {
        if (!emailProperties.isConfigured()) {
            log.info("Email sender address not configured. Skipping {} email.", type);
            return false;
        }
        if (recipientEmail == null || recipientEmail.isBlank()) {
            log.info("Recipient email not provided. Skipping {} email.", type);
            return false;
        }
        var mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            log.info("No mail server configured. Skipping {} email to {}.", type, recipientEmail);
            return false;
        }

        try {
            var message = new SimpleMailMessage();
            message.setFrom(emailProperties.getSenderAddress());
            message.setTo(recipientEmail);
            message.setSubject(subject);
            message.setText(body);
            mailSender.send(message);

            log.info("Sent {} email to {}", type, recipientEmail);
            metricsConfig.recordNotification(CHANNEL, type, true);
            return true;
        } catch (MailException e) {
            log.error("Failed to send {} email to {}: {}", type, recipientEmail, e.getMessage());
            metricsConfig.recordNotification(CHANNEL, type, false);
            return false;
        }
    }

    private static String displayName(String username) {
        return username != null && !username.isBlank() ? username : "User";
    }

    private static String descriptionLine(FieldTask task) {
        return task.getDescription() != null && !task.getDescription().isBlank()
                ? "Details: " + task.getDescription()
                : "";
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
