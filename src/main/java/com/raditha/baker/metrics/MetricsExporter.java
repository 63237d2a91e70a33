package com.raditha.baker.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.baker.analyzer.AnalysisReport;
import com.raditha.baker.bake.UnitOutcome;
import com.raditha.baker.model.DiagnosticCode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exports bake metrics to CSV and JSON formats for dashboard integration
 * and historical tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Project-level metrics aggregated from all analysed files.
     */
    public record ProjectMetrics(
            String projectName,
            LocalDateTime timestamp,
            int totalFiles,
            int totalFindings,
            int totalMarkers,
            int failedFiles,
            int malformedFiles,
            Map<String, Integer> findingsByCode,
            List<FileMetrics> files) {
    }

    /**
     * Per-file metrics.
     */
    public record FileMetrics(
            String fileName,
            int findings,
            int markers,
            int scopes,
            boolean malformed,
            String error) {
    }

    /**
     * Build aggregated metrics from batch outcomes.
     */
    public ProjectMetrics buildMetrics(List<UnitOutcome> outcomes, String projectName) {
        List<FileMetrics> fileMetrics = outcomes.stream()
                .map(this::buildFileMetrics)
                .toList();

        Map<String, Integer> byCode = new TreeMap<>();
        for (UnitOutcome outcome : outcomes) {
            if (outcome.report() == null) {
                continue;
            }
            for (Map.Entry<DiagnosticCode, Integer> entry : outcome.report().countByCode().entrySet()) {
                byCode.merge(entry.getKey().code(), entry.getValue(), Integer::sum);
            }
        }

        return new ProjectMetrics(
                projectName,
                LocalDateTime.now(),
                outcomes.size(),
                fileMetrics.stream().mapToInt(FileMetrics::findings).sum(),
                fileMetrics.stream().mapToInt(FileMetrics::markers).sum(),
                (int) outcomes.stream().filter(UnitOutcome::isFailed).count(),
                (int) fileMetrics.stream().filter(FileMetrics::malformed).count(),
                byCode,
                fileMetrics);
    }

    private FileMetrics buildFileMetrics(UnitOutcome outcome) {
        String fileName = outcome.file().toString();
        AnalysisReport report = outcome.report();
        if (report == null) {
            return new FileMetrics(fileName, 0, 0, 0, false, outcome.error());
        }
        return new FileMetrics(
                fileName,
                report.getDiagnosticCount(),
                report.fixesApplied(),
                report.scopesVisited(),
                report.malformed(),
                null);
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(ProjectMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Project Summary\n");
        csv.append("timestamp,project,total_files,total_findings,total_markers,failed_files,malformed_files\n");
        csv.append(String.format("%s,%s,%d,%d,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.projectName(),
                metrics.totalFiles(),
                metrics.totalFindings(),
                metrics.totalMarkers(),
                metrics.failedFiles(),
                metrics.malformedFiles()));

        csv.append("\n");

        csv.append("# Per-File Metrics\n");
        csv.append("file,findings,markers,scopes,malformed,error\n");
        for (FileMetrics file : metrics.files()) {
            csv.append(String.format("%s,%d,%d,%d,%s,%s\n",
                    file.fileName(),
                    file.findings(),
                    file.markers(),
                    file.scopes(),
                    file.malformed(),
                    file.error() == null ? "" : quote(file.error())));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ProjectMetrics metrics, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), metrics);
    }

    private static String quote(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
