package com.example.litigationhold.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Directory service configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.directory")
public class DirectoryServiceProperties {
    @NotBlank
    private String baseUrl;
    private String accessToken;
    @Min(1)
    @Max(999)
    private int pageSize = 999;
    private int timeoutSeconds = 30;
}
