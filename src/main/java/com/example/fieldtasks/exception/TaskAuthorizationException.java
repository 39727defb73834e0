package com.example.fieldtasks.exception;

import lombok.Getter;

/**
 * Exception for role or ownership violations
 */
@Getter
public class TaskAuthorizationException extends RuntimeException {

    private final String userId;
    private final String action;

    public TaskAuthorizationException(String message) {
        super(message);
        this.userId = null;
        this.action = null;
    }

    public TaskAuthorizationException(String userId, String action, String reason) {
        super(String.format("User %s is not allowed to %s: %s", userId, action, reason));
        this.userId = userId;
        this.action = action;
    }
}
