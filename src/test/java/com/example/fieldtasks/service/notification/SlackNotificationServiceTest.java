package com.example.fieldtasks.service.notification;

import com.example.fieldtasks.config.MetricsConfig;
import com.example.fieldtasks.config.SlackProperties;
import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.domain.enums.TaskStatus;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackNotificationService Tests")
class SlackNotificationServiceTest {

    private static final String WEBHOOK_URL = "https://hooks.slack.test/services/T000/B000/XXX";

    @Mock
    private Slack slack;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<Payload> payloadCaptor;

    private SlackProperties slackProperties;
    private SlackNotificationService slackService;
    private FieldTask task;

    @BeforeEach
    void setUp() {
        slackProperties = new SlackProperties();
        slackProperties.setWebhookUrl(WEBHOOK_URL);
        slackService = new SlackNotificationService(slackProperties, metricsConfig, slack);

        task = FieldTask.builder()
                .id(UUID.randomUUID())
                .title("Inspect site A")
                .assignee("member1-sub")
                .status(TaskStatus.IN_PROGRESS)
                .deadline(Instant.now().plusSeconds(7200))
                .build();
    }

    @Test
    @DisplayName("Should post the status change with old and new status")
    void shouldPostStatusChange() throws IOException {
        when(slack.send(eq(WEBHOOK_URL), any(Payload.class)))
                .thenReturn(WebhookResponse.builder().code(200).body("ok").build());

        var sent = slackService.sendStatusChange(task, TaskStatus.NEW, "member1", "member1 (sub: member1-sub)");

        assertThat(sent).isTrue();
        verify(slack).send(eq(WEBHOOK_URL), payloadCaptor.capture());
        var payload = payloadCaptor.getValue();
        assertThat(payload.getChannel()).isEqualTo("#field-team");
        assertThat(payload.getAttachments().get(0).getText())
                .contains("'Inspect site A'")
                .contains(task.getId().toString())
                .contains("from 'New' to 'InProgress'")
                .contains("by user member1");
        verify(metricsConfig).recordNotification("slack", "status-change", true);
    }

    @Test
    @DisplayName("Should post the deadline alert")
    void shouldPostDeadlineAlert() throws IOException {
        when(slack.send(eq(WEBHOOK_URL), any(Payload.class)))
                .thenReturn(WebhookResponse.builder().code(200).body("ok").build());

        assertThat(slackService.sendDeadlineAlert(task, "member1 (sub: member1-sub)")).isTrue();

        verify(slack).send(eq(WEBHOOK_URL), payloadCaptor.capture());
        assertThat(payloadCaptor.getValue().getText()).contains("nearing its deadline");
    }

    @Test
    @DisplayName("Should skip when the webhook is not configured")
    void shouldSkipWhenNotConfigured() {
        slackProperties.setWebhookUrl(null);

        assertThat(slackService.sendDeadlineAlert(task, "sub: member1-sub")).isFalse();
        verifyNoInteractions(slack, metricsConfig);
    }

    @Test
    @DisplayName("Should report a rejected message")
    void shouldReportRejectedMessage() throws IOException {
        when(slack.send(eq(WEBHOOK_URL), any(Payload.class)))
                .thenReturn(WebhookResponse.builder().code(500).body("internal_error").build());

        assertThat(slackService.sendStatusChange(task, TaskStatus.NEW, "admin", "sub: member1-sub")).isFalse();
        verify(metricsConfig).recordNotification("slack", "status-change", false);
    }

    @Test
    @DisplayName("Should report an I/O failure without throwing")
    void shouldReportIoFailure() throws IOException {
        when(slack.send(eq(WEBHOOK_URL), any(Payload.class))).thenThrow(new IOException("connection refused"));

        assertThat(slackService.sendDeadlineAlert(task, "sub: member1-sub")).isFalse();
        verify(metricsConfig).recordNotification("slack", "deadline", false);
    }
}
