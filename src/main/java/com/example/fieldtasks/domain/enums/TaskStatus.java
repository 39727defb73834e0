package com.example.fieldtasks.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a field task.
 * <p>
 * Progression is not enforced: any status may follow any other,
 * including Completed back to New.
 */
@Getter
@RequiredArgsConstructor
public enum TaskStatus {

    /**
     * Created and assigned, no work started yet. Initial state for all new tasks.
     */
    NEW("New", "New"),

    /**
     * The assignee has started working on the task.
     */
    IN_PROGRESS("InProgress", "In Progress"),

    /**
     * Work is done. Completed tasks are ignored by the deadline scan.
     */
    COMPLETED("Completed", "Completed");

    @JsonValue
    private final String code;
    private final String displayName;

    /**
     * Find TaskStatus by its code, accepting the enum name as well
     */
    @JsonCreator
    public static TaskStatus fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (var status : values()) {
            if (status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + code);
    }

    public boolean isCompleted() {
        return this == COMPLETED;
    }
}
