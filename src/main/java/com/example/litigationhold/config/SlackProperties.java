package com.example.litigationhold.config;

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
    private String channel = "#compliance-alerts";
    private boolean enabled = true;

    public boolean isUsable() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
