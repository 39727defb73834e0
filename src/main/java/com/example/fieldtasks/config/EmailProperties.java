package com.example.fieldtasks.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Email notification properties. The mail server itself is configured
 * through the standard {@code spring.mail.*} keys.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "notifications.email")
public class EmailProperties {
    private String senderAddress;
    private boolean enabled = true;

    public boolean isConfigured() {
        return enabled && senderAddress != null && !senderAddress.isBlank();
    }
}
