package com.example.fieldtasks.security;

import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.dto.UpdateTaskRequest;
import com.example.fieldtasks.exception.TaskAuthorizationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The single authorization gate for task and team operations.
 * <p>
 * Admins bypass ownership checks. Members may read tasks assigned to them
 * and change only the status of those tasks.
 */
@Component
public class AccessPolicy {

    public void requireAdmin(Caller caller, String action) {
        if (!caller.isAdmin()) {
            throw new TaskAuthorizationException(caller.userId(), action, "admin role required");
        }
    }

    public void requireReadAccess(Caller caller, FieldTask task) {
        if (caller.isAdmin() || task.isAssignedTo(caller.userId())) {
            return;
        }
        throw new TaskAuthorizationException(caller.userId(), "view task " + task.getId(), "task is assigned to another member");
    }

    /**
     * Members may only list their own tasks; returns the assignee filter to apply.
     */
    public String resolveAssigneeFilter(Caller caller, String requestedAssignee) {
        if (caller.isAdmin()) {
            return requestedAssignee;
        }
        if (requestedAssignee != null && !requestedAssignee.equals(caller.userId())) {
            throw new TaskAuthorizationException(caller.userId(), "list tasks of " + requestedAssignee, "members can only list their own tasks");
        }
        return caller.userId();
    }

    public void requireUpdateAccess(Caller caller, FieldTask task, UpdateTaskRequest request) {
        if (caller.isAdmin()) {
            return;
        }
        var action = "update task " + task.getId();
        if (!task.isAssignedTo(caller.userId())) {
            throw new TaskAuthorizationException(caller.userId(), action, "task is assigned to another member");
        }
        var changed = nonStatusChanges(task, request);
        if (!changed.isEmpty()) {
            throw new TaskAuthorizationException(caller.userId(), action, "members may only change status, not " + String.join(", ", changed));
        }
    }

    /**
     * Fields of the request, other than status, whose value differs from the stored task
     */
    static List<String> nonStatusChanges(FieldTask task, UpdateTaskRequest request) {
        var changed = new ArrayList<String>();
        if (request.getTitle() != null && !Objects.equals(request.getTitle(), task.getTitle())) {
            changed.add("title");
        }
        if (request.getDescription() != null && !Objects.equals(request.getDescription(), task.getDescription())) {
            changed.add("description");
        }
        if (request.getAssignee() != null && !Objects.equals(request.getAssignee(), task.getAssignee())) {
            changed.add("assignee");
        }
        if (request.getDeadline() != null && !Objects.equals(request.getDeadline(), task.getDeadline())) {
            changed.add("deadline");
        }
        return changed;
    }
}
