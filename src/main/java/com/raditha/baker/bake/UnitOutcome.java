package com.raditha.baker.bake;

import com.raditha.baker.analyzer.AnalysisReport;

import java.nio.file.Path;

/**
 * Outcome of analysing one file in a batch.
 *
 * @param file   File that was analysed
 * @param report Analysis report, null if the file failed
 * @param error  Failure message, null on success
 */
public record UnitOutcome(
        Path file,
        AnalysisReport report,
        String error) {

    public static UnitOutcome success(Path file, AnalysisReport report) {
        return new UnitOutcome(file, report, null);
    }

    public static UnitOutcome failure(Path file, String error) {
        return new UnitOutcome(file, null, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public int getDiagnosticCount() {
        return report == null ? 0 : report.getDiagnosticCount();
    }
}
