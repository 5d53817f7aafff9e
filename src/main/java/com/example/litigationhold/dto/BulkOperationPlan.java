package com.example.litigationhold.dto;

import com.example.litigationhold.domain.enums.ScaleTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Effective batch and concurrency settings for a run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BulkOperationPlan {

    /**
     * Largest number of subjects queried per status batch
     */
    private int batchSize;

    /**
     * Largest number of mutation tasks running at once
     */
    private int concurrencyLimit;

    /**
     * Batches between advisory memory cleanups, 0 disables them
     */
    private int cleanupInterval;

    /**
     * Pause after each mutation sub-batch
     */
    private long throttleDelayMs;

    private String recommendedWindow;

    private ScaleTier tier;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    /**
     * Sub-batch size used by the mutation phase, never above 100
     */
    public int getMutationBatchSize() {
        return Math.min(batchSize, 100);
    }
}
