package com.example.fieldtasks.event;

import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.domain.enums.TaskStatus;

/**
 * The status of a task changed; {@code task} carries the new status.
 */
public record TaskStatusChangedEvent(FieldTask task, TaskStatus oldStatus, String updatedBy) {
}
