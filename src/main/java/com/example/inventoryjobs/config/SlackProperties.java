package com.example.inventoryjobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#inventory-jobs-alerts";
    private boolean enabled = true;

    /**
     * Base URL of the operator dashboard, used to link dead-lettered tasks
     */
    private String dashboardBaseUrl = "http://localhost:8080";
}
