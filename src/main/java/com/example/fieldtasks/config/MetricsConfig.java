package com.example.fieldtasks.config;

import com.example.fieldtasks.domain.enums.TaskStatus;
import com.example.fieldtasks.domain.repository.FieldTaskRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the task board and notification delivery.
 * <p>
 * Exposes Prometheus metrics for:
 * - Task counts by status
 * - Notifications sent and failed per channel
 * - Deadline alerts raised by the scanner
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final FieldTaskRepository taskRepository;

    private final Map<TaskStatus, AtomicLong> statusCounts = new EnumMap<>(TaskStatus.class);

    @PostConstruct
    public void initializeMetrics() {
        for (var status : TaskStatus.values()) {
            var counter = new AtomicLong(0);
            statusCounts.put(status, counter);

            Gauge.builder("field_tasks_tasks", counter, AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of tasks by status")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically refresh the status gauges from the database
     */
    @Scheduled(fixedDelayString = "${field-tasks.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : TaskStatus.values()) {
                statusCounts.get(status).set(taskRepository.countByStatus(status));
            }
        } catch (Exception e) {
            log.warn("Could not refresh task gauges: {}", e.getMessage());
        }
    }

    /**
     * Record the outcome of one notification send
     */
    public void recordNotification(String channel, String type, boolean success) {
        meterRegistry.counter("field_tasks_notifications",
                "channel", channel,
                "type", type,
                "outcome", success ? "sent" : "failed"
        ).increment();
    }

    /**
     * Record a deadline alert claimed by the scanner
     */
    public void recordDeadlineAlert() {
        meterRegistry.counter("field_tasks_deadline_alerts").increment();
    }
}
