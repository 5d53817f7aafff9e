package com.example.litigationhold.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-subject rows and summary of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunReport {

    @Builder.Default
    private List<SubjectReportRow> rows = new ArrayList<>();

    private RunSummary summary;
}
