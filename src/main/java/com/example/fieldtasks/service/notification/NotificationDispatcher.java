package com.example.fieldtasks.service.notification;

import com.example.fieldtasks.client.ClientModels.DirectoryUser;
import com.example.fieldtasks.config.AsyncConfig;
import com.example.fieldtasks.config.FieldTasksProperties;
import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.event.TaskAssignedEvent;
import com.example.fieldtasks.event.TaskStatusChangedEvent;
import com.example.fieldtasks.service.team.TeamDirectoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Routes task events to the email and push channels.
 * <p>
 * Every method is fire-and-forget: it runs on the notification executor and
 * never throws, so a failing channel cannot fail the task operation that
 * triggered it. Task events are handled only after their transaction commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final EmailNotificationService emailNotificationService;
    private final SlackNotificationService slackNotificationService;
    private final TeamDirectoryService teamDirectoryService;
    private final FieldTasksProperties properties;

    /**
     * Email the assignee about a new or reassigned task
     */
    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTaskAssigned(TaskAssignedEvent event) {
        var task = event.task();
        var assignee = event.assignee();
        try {
            emailNotificationService.sendAssignmentEmail(assignee.getEmail(), assignee.getUsername(), task);
        } catch (Exception e) {
            log.error("Assignment notification for task {} failed: {}", task.getId(), e.getMessage(), e);
        }
    }

    /**
     * Push a status change to the team channel
     */
    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTaskStatusChanged(TaskStatusChangedEvent event) {
        var task = event.task();
        try {
            slackNotificationService.sendStatusChange(task, event.oldStatus(), event.updatedBy(), assigneeLabel(task));
        } catch (Exception e) {
            log.error("Status change notification for task {} failed: {}", task.getId(), e.getMessage(), e);
        }
    }

    /**
     * Remind the assignee by email and, if enabled, alert the team channel
     */
    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    public void deadlineApproaching(FieldTask task) {
        try {
            var assignee = teamDirectoryService.findMember(task.getAssignee());
            var label = assignee.map(user -> label(user, task.getAssignee())).orElse("sub: " + task.getAssignee());

            if (assignee.isPresent() && assignee.get().hasEmail()) {
                emailNotificationService.sendDeadlineReminder(assignee.get().getEmail(), assignee.get().getUsername(), task);
            } else {
                log.warn("No email on record for assignee {} of task {}, skipping deadline email", task.getAssignee(), task.getId());
            }

            if (properties.getDeadlineScan().isNotifyChannel()) {
                slackNotificationService.sendDeadlineAlert(task, label);
            }
        } catch (Exception e) {
            log.error("Deadline notification for task {} failed: {}", task.getId(), e.getMessage(), e);
        }
    }

    private String assigneeLabel(FieldTask task) {
        return teamDirectoryService.findMember(task.getAssignee())
                .map(user -> label(user, task.getAssignee()))
                .orElse("sub: " + task.getAssignee());
    }

    private static String label(DirectoryUser user, String userId) {
        return user.getUsername() != null ? user.getUsername() + " (sub: " + userId + ")" : "sub: " + userId;
    }
}
