package com.example.litigationhold.dto;

import com.example.litigationhold.domain.model.Subject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Subjects found in the directory and which of them enter the run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryResult {

    private long totalDiscovered;

    /**
     * Subjects entering the run, in directory order
     */
    @Builder.Default
    private List<Subject> eligibleSubjects = new ArrayList<>();

    private long skippedDisabled;
    private long skippedNoEligibleLicense;
    private long skippedByLicenseFilter;

    public long getSkipped() {
        return skippedDisabled + skippedNoEligibleLicense + skippedByLicenseFilter;
    }
}
