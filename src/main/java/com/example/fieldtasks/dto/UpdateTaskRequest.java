package com.example.fieldtasks.dto;

import com.example.fieldtasks.domain.enums.TaskStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update of a task. Fields left null are not touched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTaskRequest {

    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    private String assignee;

    private TaskStatus status;

    private Instant deadline;

    @JsonIgnore
    public boolean isEmpty() {
        return title == null && description == null && assignee == null && status == null && deadline == null;
    }
}
