package com.raditha.baker.analyzer;

import com.raditha.baker.model.Diagnostic;
import com.raditha.baker.model.DiagnosticCode;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Determinism analysis results for one source unit.
 *
 * @param sourceFile      File the content came from, may be null for in-memory content
 * @param diagnostics     Findings in source order
 * @param fixesApplied    Number of marker statements inserted
 * @param scopesVisited   Number of scopes walked, including the file scope
 * @param malformed       True if part of the unit was skipped because of unbalanced delimiters
 * @param originalContent Source before fixing
 * @param patchedContent  Source after fixing; equal to the original in check mode
 */
public record AnalysisReport(
        Path sourceFile,
        List<Diagnostic> diagnostics,
        int fixesApplied,
        int scopesVisited,
        boolean malformed,
        String originalContent,
        String patchedContent) {

    public AnalysisReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public int getDiagnosticCount() {
        return diagnostics.size();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Check if the patched content differs from the original.
     */
    public boolean isChanged() {
        return !originalContent.equals(patchedContent);
    }

    /**
     * Count findings per code.
     */
    public Map<DiagnosticCode, Integer> countByCode() {
        Map<DiagnosticCode, Integer> counts = new TreeMap<>();
        for (Diagnostic diagnostic : diagnostics) {
            counts.merge(diagnostic.code(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "Found %d dynamic call%s in %d scope%s (%d marker%s inserted%s)",
                diagnostics.size(), diagnostics.size() == 1 ? "" : "s",
                scopesVisited, scopesVisited == 1 ? "" : "s",
                fixesApplied, fixesApplied == 1 ? "" : "s",
                malformed ? ", unbalanced delimiters skipped" : "");
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("File: ").append(sourceFile == null ? "(content)" : sourceFile).append("\n");
        sb.append(getSummary()).append("\n");
        if (diagnostics.isEmpty()) {
            sb.append("No dynamic calls found.\n");
            return sb.toString();
        }
        sb.append("-".repeat(80)).append("\n");
        for (Diagnostic diagnostic : diagnostics) {
            sb.append(String.format("  %5d:%-4d %s%s%n",
                    diagnostic.line(),
                    diagnostic.column(),
                    diagnostic.message(),
                    diagnostic.fixed() ? " [fixed]" : ""));
        }
        return sb.toString();
    }
}
