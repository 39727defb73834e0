package com.example.fieldtasks.security;

import com.example.fieldtasks.domain.enums.TeamRole;

import java.util.Objects;

/**
 * The authenticated user behind a request, resolved from the bearer token.
 *
 * @param userId   identity provider subject, the value stored as a task's assignee
 * @param username display name used in notifications and audit fields
 * @param role     admin or member
 */
public record Caller(String userId, String username, TeamRole role) {

    public Caller {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
        if (username == null || username.isBlank()) {
            username = userId;
        }
    }

    public boolean isAdmin() {
        return role == TeamRole.ADMIN;
    }
}
