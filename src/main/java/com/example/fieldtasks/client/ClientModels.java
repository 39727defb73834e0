package com.example.fieldtasks.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request/Response DTOs for the identity provider's user directory API
 */
public class ClientModels {
    private ClientModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DirectoryUser {
        /**
         * Stable subject identifier, the value carried in the JWT {@code sub} claim
         */
        private String userId;
        private String username;
        private String email;
        private boolean enabled;
        private String status;
        @Builder.Default
        private List<String> groups = new ArrayList<>();

        public boolean hasEmail() {
            return email != null && !email.isBlank();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DirectoryUserPage {
        private List<DirectoryUser> users = new ArrayList<>();
        private String nextToken;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateDirectoryUserRequest {
        private String username;
        private String email;
        private boolean emailVerified;
        private String temporaryPassword;
        private String deliveryMedium;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GroupMembershipRequest {
        private String groupName;
    }
}
