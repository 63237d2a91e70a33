package com.raditha.baker.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.baker.analyzer.AnalysisReport;
import com.raditha.baker.bake.UnitOutcome;
import com.raditha.baker.model.Diagnostic;
import com.raditha.baker.model.DiagnosticCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsExporterTest {

    @TempDir
    Path tempDir;

    private final MetricsExporter exporter = new MetricsExporter();
    private List<UnitOutcome> outcomes;

    @BeforeEach
    void setUp() {
        Diagnostic found = new Diagnostic(DiagnosticCode.FOUND, "time", "time", 2, 1, true);
        Diagnostic possible = new Diagnostic(DiagnosticCode.FOUND_POSSIBLE_STATIC, "date", "date", 5, 3, false);
        AnalysisReport dynamic = new AnalysisReport(Path.of("a.php"), List.of(found, possible), 1, 2, false, "a", "b");
        AnalysisReport clean = new AnalysisReport(Path.of("b.php"), List.of(), 0, 1, true, "c", "c");
        outcomes = List.of(
                UnitOutcome.success(Path.of("a.php"), dynamic),
                UnitOutcome.success(Path.of("b.php"), clean),
                UnitOutcome.failure(Path.of("c.php"), "No namespace, \"c\""));
    }

    @Test
    void testBuildMetrics() {
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(outcomes, "shop");

        assertEquals("shop", metrics.projectName());
        assertEquals(3, metrics.totalFiles());
        assertEquals(2, metrics.totalFindings());
        assertEquals(1, metrics.totalMarkers());
        assertEquals(1, metrics.failedFiles());
        assertEquals(1, metrics.malformedFiles());
        assertEquals(1, metrics.findingsByCode().get("Found").intValue());
        assertEquals(1, metrics.findingsByCode().get("FoundPossibleStatic").intValue());
        assertEquals("No namespace, \"c\"", metrics.files().get(2).error());
    }

    @Test
    void testExportToCsv() throws IOException {
        Path csv = tempDir.resolve("metrics.csv");
        exporter.exportToCsv(exporter.buildMetrics(outcomes, "shop"), csv);

        List<String> lines = Files.readAllLines(csv);
        assertEquals("# Project Summary", lines.get(0));
        assertTrue(lines.get(2).endsWith(",shop,3,2,1,1,1"));
        assertTrue(lines.contains("a.php,2,1,2,false,"));
        assertTrue(lines.contains("c.php,0,0,0,false,\"No namespace, \"\"c\"\"\""));
    }

    @Test
    void testExportToJson() throws IOException {
        Path json = tempDir.resolve("metrics.json");
        exporter.exportToJson(exporter.buildMetrics(outcomes, "shop"), json);

        JsonNode root = new ObjectMapper().readTree(json.toFile());
        assertEquals("shop", root.get("projectName").asText());
        assertEquals(2, root.get("totalFindings").asInt());
        assertEquals(3, root.get("files").size());
        assertTrue(root.get("timestamp").isTextual());
        assertEquals(1, root.get("findingsByCode").get("FoundPossibleStatic").asInt());
    }
}
