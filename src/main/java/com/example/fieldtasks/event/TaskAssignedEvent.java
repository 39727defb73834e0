package com.example.fieldtasks.event;

import com.example.fieldtasks.client.ClientModels.DirectoryUser;
import com.example.fieldtasks.domain.entity.FieldTask;

/**
 * A task was created for, or reassigned to, {@code assignee}.
 */
public record TaskAssignedEvent(FieldTask task, DirectoryUser assignee) {
}
