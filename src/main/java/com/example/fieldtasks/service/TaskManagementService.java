package com.example.fieldtasks.service;

import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.domain.enums.TaskStatus;
import com.example.fieldtasks.domain.repository.FieldTaskRepository;
import com.example.fieldtasks.dto.CreateTaskRequest;
import com.example.fieldtasks.dto.TaskResponse;
import com.example.fieldtasks.dto.TaskSearchCriteria;
import com.example.fieldtasks.dto.UpdateTaskRequest;
import com.example.fieldtasks.event.TaskAssignedEvent;
import com.example.fieldtasks.event.TaskStatusChangedEvent;
import com.example.fieldtasks.exception.TaskNotFoundException;
import com.example.fieldtasks.exception.TaskValidationException;
import com.example.fieldtasks.mapper.TaskMapper;
import com.example.fieldtasks.security.AccessPolicy;
import com.example.fieldtasks.security.Caller;
import com.example.fieldtasks.service.team.TeamDirectoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Service for the task board.
 * <p>
 * Provides:
 * - Task creation and assignment (admin)
 * - Listing, scoped to the caller's own tasks for members
 * - Updates: any field for admins, status only for the assignee
 * - Deletion (admin)
 * <p>
 * Assignment and status changes are published as events; notifications go
 * out only once the transaction has committed and never fail the operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskManagementService {

    private final FieldTaskRepository taskRepository;
    private final TaskMapper taskMapper;
    private final AccessPolicy accessPolicy;
    private final TeamDirectoryService teamDirectoryService;
    private final ApplicationEventPublisher eventPublisher;

    // === Task Creation ===

    /**
     * Create a task and assign it. The assignee must exist in the directory
     * and have an email address.
     */
    @Transactional
    public TaskResponse createTask(Caller caller, CreateTaskRequest request) {
        accessPolicy.requireAdmin(caller, "create tasks");
        requireTitle(request.getTitle());

        log.info("Creating task '{}' for assignee {}", request.getTitle(), request.getAssignee());
        var assignee = teamDirectoryService.requireAssignableMember(request.getAssignee());

        var task = FieldTask.builder()
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .assignee(request.getAssignee())
                .status(TaskStatus.NEW)
                .deadline(request.getDeadline())
                .createdBy(caller.username())
                .build();

        task = taskRepository.save(task);
        log.info("Created task {} assigned to {}", task.getId(), task.getAssignee());

        eventPublisher.publishEvent(new TaskAssignedEvent(task, assignee));
        return taskMapper.toResponse(task);
    }

    // === Task Retrieval ===

    /**
     * List tasks ordered by creation time. Members only ever see their own.
     */
    @Transactional(readOnly = true)
    public List<TaskResponse> listTasks(Caller caller, TaskSearchCriteria criteria) {
        var assignee = accessPolicy.resolveAssigneeFilter(caller, criteria.getAssignee());
        var status = criteria.getStatus();

        List<FieldTask> tasks;
        if (assignee != null && status != null) {
            tasks = taskRepository.findByAssigneeAndStatusOrderByCreatedAtAsc(assignee, status);
        } else if (assignee != null) {
            tasks = taskRepository.findByAssigneeOrderByCreatedAtAsc(assignee);
        } else if (status != null) {
            tasks = taskRepository.findByStatusOrderByCreatedAtAsc(status);
        } else {
            tasks = taskRepository.findAllByOrderByCreatedAtAsc();
        }

        return taskMapper.toResponseList(tasks);
    }

    /**
     * Get task by ID
     */
    @Transactional(readOnly = true)
    public TaskResponse getTask(Caller caller, UUID taskId) {
        var task = taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        accessPolicy.requireReadAccess(caller, task);
        return taskMapper.toResponse(task);
    }

    // === Task Updates ===

    /**
     * Apply a partial update. Members may only change the status of tasks
     * assigned to them.
     */
    @Transactional
    public TaskResponse updateTask(Caller caller, UUID taskId, UpdateTaskRequest request) {
        if (request == null || request.isEmpty()) {
            throw new TaskValidationException("No fields to update");
        }

        var task = taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        accessPolicy.requireUpdateAccess(caller, task, request);

        if (request.getTitle() != null) {
            requireTitle(request.getTitle());
        }

        var oldStatus = task.getStatus();
        var reassigned = request.getAssignee() != null && !task.isAssignedTo(request.getAssignee());
        var newAssignee = reassigned ? teamDirectoryService.requireAssignableMember(request.getAssignee()) : null;

        if (request.getTitle() != null) {
            task.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            task.setDescription(request.getDescription());
        }
        if (reassigned) {
            task.setAssignee(request.getAssignee());
        }
        if (request.getStatus() != null) {
            task.setStatus(request.getStatus());
        }
        if (request.getDeadline() != null && !Objects.equals(request.getDeadline(), task.getDeadline())) {
            task.rescheduleDeadline(request.getDeadline());
        }

        task = taskRepository.save(task);
        log.info("Task {} updated by {}", taskId, caller.username());

        if (task.getStatus() != oldStatus) {
            log.info("Task {} status changed from {} to {} by {}", taskId, oldStatus, task.getStatus(), caller.username());
            eventPublisher.publishEvent(new TaskStatusChangedEvent(task, oldStatus, caller.username()));
        }
        if (newAssignee != null) {
            log.info("Task {} reassigned to {}", taskId, task.getAssignee());
            eventPublisher.publishEvent(new TaskAssignedEvent(task, newAssignee));
        }

        return taskMapper.toResponse(task);
    }

    // === Task Deletion ===

    /**
     * Delete a task. Admin only.
     */
    @Transactional
    public void deleteTask(Caller caller, UUID taskId) {
        accessPolicy.requireAdmin(caller, "delete tasks");

        var task = taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        taskRepository.delete(task);
        log.info("Task {} deleted by {}", taskId, caller.username());
    }

    private static void requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new TaskValidationException("title", "Title must not be blank");
        }
    }
}
