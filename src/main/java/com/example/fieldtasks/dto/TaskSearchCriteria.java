package com.example.fieldtasks.dto;

import com.example.fieldtasks.domain.enums.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional filters for listing tasks
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSearchCriteria {
    private TaskStatus status;
    private String assignee;

    public static TaskSearchCriteria none() {
        return new TaskSearchCriteria();
    }
}
