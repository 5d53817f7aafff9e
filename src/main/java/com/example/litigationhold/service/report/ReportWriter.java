package com.example.litigationhold.service.report;

import com.example.litigationhold.config.LitigationHoldProperties;
import com.example.litigationhold.dto.RunReport;
import com.example.litigationhold.dto.SubjectReportRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the per-subject CSV report and the JSON summary of a run.
 */
@Slf4j
@Component
public class ReportWriter {

    private final LitigationHoldProperties properties;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public ReportWriter(LitigationHoldProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        this.csvMapper = CsvMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    /**
     * Write both files into the configured output directory
     *
     * @param report The run report
     * @return Paths of the written files
     * @throws IOException if a file cannot be written
     */
    public List<Path> write(RunReport report) throws IOException {
        var outputDir = Path.of(properties.getReport().getOutputDir());
        Files.createDirectories(outputDir);

        var runId = report.getSummary().getRunId();
        var csvPath = outputDir.resolve("litigation-hold-report-" + runId + ".csv");
        var summaryPath = outputDir.resolve("litigation-hold-summary-" + runId + ".json");

        var schema = csvMapper.schemaFor(SubjectReportRow.class).withHeader();
        csvMapper.writer(schema).writeValue(csvPath.toFile(), report.getRows());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(summaryPath.toFile(), report.getSummary());

        log.info("Report written to {} ({} rows), summary to {}", csvPath, report.getRows().size(), summaryPath);

        var written = new ArrayList<Path>();
        written.add(csvPath);
        written.add(summaryPath);
        return written;
    }
}
