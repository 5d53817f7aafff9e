package com.example.litigationhold.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Mailbox status service configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.mailbox")
public class MailboxServiceProperties {
    @NotBlank
    private String baseUrl;
    private String accessToken;
    private int timeoutSeconds = 30;
}
