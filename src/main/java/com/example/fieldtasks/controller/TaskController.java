package com.example.fieldtasks.controller;

import com.example.fieldtasks.domain.enums.TaskStatus;
import com.example.fieldtasks.dto.ApiResponse;
import com.example.fieldtasks.dto.CreateTaskRequest;
import com.example.fieldtasks.dto.TaskResponse;
import com.example.fieldtasks.dto.TaskSearchCriteria;
import com.example.fieldtasks.dto.UpdateTaskRequest;
import com.example.fieldtasks.security.Caller;
import com.example.fieldtasks.service.TaskManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for the task board.
 * <p>
 * Provides endpoints for:
 * - Creating and assigning tasks
 * - Listing and retrieving tasks
 * - Updating status and details
 * - Deleting tasks
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/tasks")
@Tag(name = "Tasks", description = "APIs for creating, tracking and completing field tasks")
public class TaskController {

    private final TaskManagementService taskManagementService;

    @PostMapping
    @Operation(summary = "Create a task", description = "Create a task and assign it to a team member. Admin only.")
    public ResponseEntity<ApiResponse<TaskResponse>> createTask(@Parameter(hidden = true) Caller caller,
                                                                @Valid @RequestBody CreateTaskRequest request) {
        log.info("API: Create task '{}' for {} by {}", request.getTitle(), request.getAssignee(), caller.username());

        var response = taskManagementService.createTask(caller, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Task created successfully"));
    }

    @GetMapping
    @Operation(summary = "List tasks", description = "Admins see all tasks, members see the tasks assigned to them")
    public ResponseEntity<ApiResponse<List<TaskResponse>>> listTasks(
            @Parameter(hidden = true) Caller caller,
            @Parameter(description = "Status filter (New, InProgress, Completed)") @RequestParam(required = false) TaskStatus status,
            @Parameter(description = "Assignee user id filter") @RequestParam(required = false) String assignee) {

        var criteria = TaskSearchCriteria.builder().status(status).assignee(assignee).build();
        var tasks = taskManagementService.listTasks(caller, criteria);
        return ResponseEntity.ok(ApiResponse.success(tasks));
    }

    @GetMapping("/{taskId}")
    @Operation(summary = "Get task by ID", description = "Retrieve a task by its unique identifier")
    public ResponseEntity<ApiResponse<TaskResponse>> getTask(@Parameter(hidden = true) Caller caller,
                                                             @Parameter(description = "Task UUID") @PathVariable UUID taskId) {
        return ResponseEntity.ok(ApiResponse.success(taskManagementService.getTask(caller, taskId)));
    }

    @RequestMapping(value = "/{taskId}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    @Operation(summary = "Update a task", description = "Admins may change any field; members may change the status of their own tasks")
    public ResponseEntity<ApiResponse<TaskResponse>> updateTask(@Parameter(hidden = true) Caller caller,
                                                                @Parameter(description = "Task UUID") @PathVariable UUID taskId,
                                                                @Valid @RequestBody UpdateTaskRequest request) {
        log.info("API: Update task {} by {}", taskId, caller.username());

        var response = taskManagementService.updateTask(caller, taskId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Task updated successfully"));
    }

    @DeleteMapping("/{taskId}")
    @Operation(summary = "Delete a task", description = "Delete a task. Admin only.")
    public ResponseEntity<ApiResponse<Void>> deleteTask(@Parameter(hidden = true) Caller caller,
                                                        @Parameter(description = "Task UUID") @PathVariable UUID taskId) {
        log.info("API: Delete task {} by {}", taskId, caller.username());

        taskManagementService.deleteTask(caller, taskId);
        return ResponseEntity.ok(ApiResponse.success(null, "Task deleted successfully"));
    }

    // === Health Check ===

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the task tracker is healthy")
    public ResponseEntity<ApiResponse<String>> healthCheck() {
        return ResponseEntity.ok(ApiResponse.success("OK", "Task tracker is running"));
    }
}
