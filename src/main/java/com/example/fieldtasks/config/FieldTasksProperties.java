package com.example.fieldtasks.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the field task tracker.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "field-tasks")
public class FieldTasksProperties {

    /**
     * Number of threads delivering notifications in the background
     */
    @Min(1)
    private int notificationPoolSize = 4;

    /**
     * Queue capacity of the notification executor
     */
    @Min(1)
    private int notificationQueueCapacity = 200;

    @Valid
    private DeadlineScan deadlineScan = new DeadlineScan();

    @Data
    public static class DeadlineScan {

        /**
         * How far ahead of now a deadline counts as approaching
         */
        @Min(1)
        private int lookaheadHours = 24;

        /**
         * Delay between two scans in milliseconds (default hourly)
         */
        @Min(1000)
        private long intervalMs = 3_600_000L;

        /**
         * Maximum number of tasks alerted per scan
         */
        @Min(1)
        private int batchSize = 500;

        /**
         * Also publish deadline alerts to the team channel, not only to the assignee
         */
        private boolean notifyChannel = true;

        public Duration getLookahead() {
            return Duration.ofHours(lookaheadHours);
        }
    }
}
