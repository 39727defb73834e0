package com.example.fieldtasks.service.deadline;

import com.example.fieldtasks.config.FieldTasksProperties;
import com.example.fieldtasks.config.MetricsConfig;
import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.domain.enums.TaskStatus;
import com.example.fieldtasks.domain.repository.FieldTaskRepository;
import com.example.fieldtasks.dto.DeadlineScanResult;
import com.example.fieldtasks.service.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic scan for tasks whose deadline is approaching.
 * <p>
 * ShedLock keeps the scheduled run on one instance at a time. Each candidate
 * is claimed with a conditional update of its notification marker before the
 * alert is dispatched, so repeated or overlapping runs (including manual ones)
 * alert a given deadline once.
 * <p>
 * Flow:
 * 1. Select open, un-alerted tasks with a deadline before now + lookahead
 * 2. Claim the marker of each task
 * 3. Dispatch the alert for each claimed task
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadlineScannerService {

    private final FieldTaskRepository taskRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final FieldTasksProperties properties;
    private final MetricsConfig metricsConfig;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    /**
     * Scheduled entry point
     */
    @Scheduled(fixedDelayString = "${field-tasks.deadline-scan.interval-ms:3600000}",
            initialDelayString = "${field-tasks.deadline-scan.initial-delay-ms:60000}")
    @SchedulerLock(name = "deadlineScan", lockAtLeastFor = "30s", lockAtMostFor = "15m")
    public void scheduledScan() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous deadline scan still running, skipping");
            return;
        }

        try {
            scan(Instant.now());
        } catch (Exception e) {
            log.error("Error in deadline scan: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Run one scan as of {@code now}.
     */
    public DeadlineScanResult scan(Instant now) {
        var scanConfig = properties.getDeadlineScan();
        var horizon = now.plus(scanConfig.getLookahead());

        var candidates = taskRepository.findDeadlineAlertCandidates(TaskStatus.COMPLETED, horizon,
                PageRequest.of(0, scanConfig.getBatchSize()));

        var result = DeadlineScanResult.builder()
                .scannedAt(now)
                .horizon(horizon)
                .candidates(candidates.size())
                .alertedTaskIds(new ArrayList<>())
                .build();

        if (candidates.isEmpty()) {
            log.debug("No deadlines before {} need an alert", horizon);
            return result;
        }

        log.info("Found {} tasks with a deadline before {}", candidates.size(), horizon);

        for (var task : candidates) {
            try {
                if (alert(task, now)) {
                    result.setAlerted(result.getAlerted() + 1);
                    result.getAlertedTaskIds().add(task.getId());
                } else {
                    result.setSkipped(result.getSkipped() + 1);
                }
            } catch (Exception e) {
                result.setFailed(result.getFailed() + 1);
                log.error("Deadline alert for task {} failed: {}", task.getId(), e.getMessage(), e);
            }
        }

        log.info("Deadline scan finished: {} alerted, {} already alerted, {} failed",
                result.getAlerted(), result.getSkipped(), result.getFailed());
        return result;
    }

    private boolean alert(FieldTask task, Instant now) {
        if (taskRepository.claimDeadlineAlert(task.getId(), now) == 0) {
            log.debug("Deadline alert for task {} already claimed", task.getId());
            return false;
        }

        task.setDeadlineNotifiedAt(now);
        notificationDispatcher.deadlineApproaching(task);
        metricsConfig.recordDeadlineAlert();

        log.info("Deadline alert raised for task {} (deadline {}, assignee {})", task.getId(), task.getDeadline(), task.getAssignee());
        return true;
    }
}
