package com.example.litigationhold.service.report;

import com.example.litigationhold.config.LitigationHoldProperties;
import com.example.litigationhold.domain.enums.HoldAction;
import com.example.litigationhold.dto.RunReport;
import com.example.litigationhold.dto.RunSummary;
import com.example.litigationhold.dto.SubjectReportRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReportWriter Tests")
class ReportWriterTest {

    @TempDir
    Path outputDir;

    @Test
    @DisplayName("Should write the CSV report and the JSON summary")
    void shouldWriteReportFiles() throws Exception {
        // Given
        var properties = new LitigationHoldProperties();
        properties.getReport().setOutputDir(outputDir.resolve("reports").toString());
        var writer = new ReportWriter(properties, new ObjectMapper());

        var report = RunReport.builder()
                .rows(List.of(SubjectReportRow.builder()
                        .identity("alice@contoso.com")
                        .displayName("Alice")
                        .accountEnabled(true)
                        .holdEnabled(false)
                        .hasMailbox(true)
                        .licenses("ENTERPRISEPACK")
                        .action(HoldAction.ENABLED)
                        .timestamp(Instant.parse("2024-05-01T12:00:00Z"))
                        .build()))
                .summary(RunSummary.builder()
                        .runId("abc")
                        .totalEligible(1)
                        .newlyEnabled(1)
                        .startedAt(Instant.parse("2024-05-01T11:59:00Z"))
                        .finishedAt(Instant.parse("2024-05-01T12:00:00Z"))
                        .elapsed(Duration.ofMinutes(1))
                        .build())
                .build();

        // When
        var written = writer.write(report);

        // Then
        assertThat(written).hasSize(2);
        var csv = Files.readAllLines(written.get(0));
        assertThat(written.get(0).getFileName().toString()).isEqualTo("litigation-hold-report-abc.csv");
        assertThat(csv.get(0)).startsWith("identity,displayName,accountEnabled,holdEnabled");
        assertThat(csv.get(1)).contains("alice@contoso.com", "enabled", "2024-05-01T12:00:00Z");

        var summary = new ObjectMapper().readTree(written.get(1).toFile());
        assertThat(written.get(1).getFileName().toString()).isEqualTo("litigation-hold-summary-abc.json");
        assertThat(summary.get("runId").asText()).isEqualTo("abc");
        assertThat(summary.get("newlyEnabled").asLong()).isEqualTo(1);
        assertThat(summary.get("elapsed").asText()).isEqualTo("PT1M");
        assertThat(summary.has("haltReason")).isFalse();
    }
}
