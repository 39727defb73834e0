package com.example.fieldtasks.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background notification delivery.
 * <p>
 * Notifications are fire-and-forget from the request's point of view, so they
 * run on a small bounded pool instead of the request thread.
 */
@Slf4j
@EnableAsync
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

    private final FieldTasksProperties properties;

    /**
     * Executor for {@code @Async} notification sends.
     * When the queue is full the notification is dropped with a warning
     * rather than blocking the caller.
     */
    @Bean(name = NOTIFICATION_EXECUTOR)
    public TaskExecutor notificationExecutor() {
        log.info("Configuring notification executor with {} threads", properties.getNotificationPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getNotificationPoolSize());
        executor.setMaxPoolSize(properties.getNotificationPoolSize() * 2);
        executor.setQueueCapacity(properties.getNotificationQueueCapacity());
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("Notification executor saturated, dropping notification"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
