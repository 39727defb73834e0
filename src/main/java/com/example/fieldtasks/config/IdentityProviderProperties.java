package com.example.fieldtasks.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Identity provider configuration: user directory endpoint and the JWT claims
 * carrying the caller's identity.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "identity-provider")
public class IdentityProviderProperties {

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String userPoolId;

    @Min(1)
    private int timeoutSeconds = 10;

    /**
     * Claim holding the caller's display username (falls back to the subject)
     */
    private String usernameClaim = "preferred_username";

    /**
     * Claim holding the caller's group names
     */
    private String groupsClaim = "groups";

    /**
     * Temporary password for users created without one
     */
    private String defaultTemporaryPassword = "TempPassword123!";
}
