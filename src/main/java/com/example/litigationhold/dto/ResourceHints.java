package com.example.litigationhold.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Host resource hints fed to the configuration advisor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceHints {

    public static final int DEFAULT_MEMORY_MB = 4096;
    public static final int DEFAULT_BANDWIDTH_MBPS = 100;

    private int availableMemoryMb;
    private int bandwidthMbps;

    public static ResourceHints defaults() {
        return new ResourceHints(DEFAULT_MEMORY_MB, DEFAULT_BANDWIDTH_MBPS);
    }
}
