package com.example.fieldtasks.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for inviting a new member to the team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTeamMemberRequest {

    @NotBlank(message = "Username is required")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid address")
    private String email;

    /**
     * Optional; the configured default is used when absent
     */
    private String temporaryPassword;
}
