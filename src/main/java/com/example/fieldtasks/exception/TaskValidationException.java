package com.example.fieldtasks.exception;

import lombok.Getter;

/**
 * Exception for missing or malformed request fields
 */
@Getter
public class TaskValidationException extends RuntimeException {

    private final String field;

    public TaskValidationException(String message) {
        this(null, message);
    }

    public TaskValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
