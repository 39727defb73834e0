package com.example.fieldtasks.dto;

import com.example.fieldtasks.domain.enums.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for task data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    private UUID id;
    private String title;
    private String description;
    private String assignee;
    private TaskStatus status;
    private Instant deadline;
    private Instant deadlineNotifiedAt;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
}
