package com.example.inventoryjobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings of the HTTP mail API used for loan reminders
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "notifications.email")
public class EmailProperties {
    private boolean enabled = false;
    private String baseUrl;
    private String apiKey;
    private String from = "Inventory <noreply@example.com>";
    private int timeoutSeconds = 10;
}
