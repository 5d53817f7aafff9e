package com.example.litigationhold.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for a litigation hold run.
 * Loaded from application.yml and overridable from the command line,
 * e.g. {@code --litigation-hold.preview=false --litigation-hold.max-errors=10}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "litigation-hold")
public class LitigationHoldProperties {

    /**
     * Compute and report the actions without enabling any hold
     */
    private boolean preview = true;

    /**
     * Status query batch size, overrides the advised value when set
     */
    @Min(1)
    @Max(2000)
    private Integer batchSize;

    /**
     * Concurrent mutation limit, overrides the advised value when set
     */
    @Min(1)
    @Max(25)
    private Integer concurrencyLimit;

    /**
     * Error count above which the run halts
     */
    @Min(0)
    private int maxErrors = 50;

    /**
     * Keep going whatever the error count
     */
    private boolean continueOnErrors = false;

    /**
     * Only consider identities starting with this prefix
     */
    private String identityFilter;

    /**
     * Only consider subjects holding one of these SKU part numbers
     */
    private List<String> licenseFilter = new ArrayList<>();

    /**
     * Consider disabled accounts as well
     */
    private boolean includeDisabledAccounts = false;

    /**
     * Hold duration in days, unlimited when unset
     */
    @Min(1)
    private Integer holdDurationDays;

    /**
     * Recorded as the hold owner, the service default when unset
     */
    private String holdOwner;

    /**
     * Size of the mutation worker pool, the ceiling for any concurrency limit
     */
    @Min(1)
    @Max(25)
    private int maxWorkerThreads = 25;

    @Min(1)
    private int memoryHintMb = 4096;

    @Min(1)
    private int bandwidthHintMbps = 100;

    /**
     * JSON license eligibility table, the built-in table when unset or unusable
     */
    private String licenseTablePath;

    @Valid
    private Report report = new Report();

    @Data
    public static class Report {

        private boolean enabled = true;

        @NotBlank
        private String outputDir = "./reports";
    }
}
