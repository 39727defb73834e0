package com.example.fieldtasks.service.deadline;

import com.example.fieldtasks.config.FieldTasksProperties;
import com.example.fieldtasks.config.MetricsConfig;
import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.domain.enums.TaskStatus;
import com.example.fieldtasks.domain.repository.FieldTaskRepository;
import com.example.fieldtasks.service.notification.NotificationDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeadlineScannerService Tests")
class DeadlineScannerServiceTest {

    @Mock
    private FieldTaskRepository taskRepository;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<Pageable> pageableCaptor;

    private FieldTasksProperties properties;
    private DeadlineScannerService scannerService;

    private Instant createdAt;
    private FieldTask task;

    @BeforeEach
    void setUp() {
        properties = new FieldTasksProperties();
        properties.getDeadlineScan().setLookaheadHours(24);
        properties.getDeadlineScan().setBatchSize(50);
        scannerService = new DeadlineScannerService(taskRepository, notificationDispatcher, properties, metricsConfig);

        createdAt = Instant.parse("2030-05-01T08:00:00Z");
        task = FieldTask.builder()
                .id(UUID.randomUUID())
                .title("Inspect site A")
                .assignee("member1-sub")
                .status(TaskStatus.NEW)
                .deadline(createdAt.plus(Duration.ofHours(2)))
                .build();
    }

    @Test
    @DisplayName("Should alert a task whose deadline falls inside the lookahead")
    void shouldAlertApproachingDeadline() {
        // Given
        var now = createdAt.plus(Duration.ofHours(1));
        when(taskRepository.findDeadlineAlertCandidates(eq(TaskStatus.COMPLETED), eq(now.plus(Duration.ofHours(24))), any(Pageable.class)))
                .thenReturn(List.of(task));
        when(taskRepository.claimDeadlineAlert(task.getId(), now)).thenReturn(1);

        // When
        var result = scannerService.scan(now);

        // Then
        assertThat(result.getCandidates()).isEqualTo(1);
        assertThat(result.getAlerted()).isEqualTo(1);
        assertThat(result.getAlertedTaskIds()).containsExactly(task.getId());
        assertThat(task.getDeadlineNotifiedAt()).isEqualTo(now);
        verify(notificationDispatcher).deadlineApproaching(task);
        verify(metricsConfig).recordDeadlineAlert();
    }

    @Test
    @DisplayName("Should not alert the same deadline on a second scan")
    void shouldNotAlertTwice() {
        var firstScan = createdAt.plus(Duration.ofHours(1));
        var secondScan = createdAt.plus(Duration.ofMinutes(90));

        when(taskRepository.findDeadlineAlertCandidates(eq(TaskStatus.COMPLETED), any(Instant.class), any(Pageable.class)))
                .thenReturn(List.of(task));
        when(taskRepository.claimDeadlineAlert(task.getId(), firstScan)).thenReturn(1);
        when(taskRepository.claimDeadlineAlert(task.getId(), secondScan)).thenReturn(0);

        var first = scannerService.scan(firstScan);
        var second = scannerService.scan(secondScan);

        assertThat(first.getAlerted()).isEqualTo(1);
        assertThat(second.getAlerted()).isZero();
        assertThat(second.getSkipped()).isEqualTo(1);
        verify(notificationDispatcher, times(1)).deadlineApproaching(task);
    }

    @Test
    @DisplayName("Should keep scanning when one alert fails")
    void shouldContinueAfterFailure() {
        // Given
        var now = createdAt.plus(Duration.ofHours(1));
        var other = FieldTask.builder()
                .id(UUID.randomUUID())
                .title("Inspect site B")
                .assignee("member2-sub")
                .status(TaskStatus.IN_PROGRESS)
                .deadline(createdAt.plus(Duration.ofHours(3)))
                .build();

        when(taskRepository.findDeadlineAlertCandidates(any(), any(), any())).thenReturn(List.of(task, other));
        when(taskRepository.claimDeadlineAlert(task.getId(), now)).thenThrow(new IllegalStateException("connection reset"));
        when(taskRepository.claimDeadlineAlert(other.getId(), now)).thenReturn(1);

        // When
        var result = scannerService.scan(now);

        // Then
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getAlerted()).isEqualTo(1);
        assertThat(result.getAlertedTaskIds()).containsExactly(other.getId());
        verify(notificationDispatcher).deadlineApproaching(other);
        verify(notificationDispatcher, never()).deadlineApproaching(task);
    }

    @Test
    @DisplayName("Should limit each scan to the configured batch size")
    void shouldUseBatchSize() {
        when(taskRepository.findDeadlineAlertCandidates(any(), any(), pageableCaptor.capture())).thenReturn(List.of());

        var result = scannerService.scan(createdAt);

        assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(50);
        assertThat(result.getCandidates()).isZero();
        verifyNoInteractions(notificationDispatcher);
    }

    @Test
    @DisplayName("Scheduled scan should log and swallow errors")
    void scheduledScanShouldSwallowErrors() {
        when(taskRepository.findDeadlineAlertCandidates(any(), any(), any())).thenThrow(new IllegalStateException("database down"));

        assertThatCode(() -> scannerService.scheduledScan()).doesNotThrowAnyException();
    }
}
