package com.example.litigationhold.dto;

import com.example.litigationhold.domain.enums.HoldAction;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One line of the per-subject report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"identity", "displayName", "accountEnabled", "holdEnabled", "holdDate", "holdOwner",
        "hasMailbox", "licenses", "action", "error", "timestamp", "note"})
public class SubjectReportRow {

    private String identity;
    private String displayName;
    private boolean accountEnabled;
    private Boolean holdEnabled;
    private Instant holdDate;
    private String holdOwner;
    private Boolean hasMailbox;

    /**
     * License SKU part numbers joined with ';'
     */
    private String licenses;

    private HoldAction action;
    private String error;
    private Instant timestamp;
    private String note;
}
