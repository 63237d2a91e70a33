package com.raditha.baker.bake;

import com.raditha.baker.analyzer.AnalysisReport;

/**
 * Result of {@link CacheBaker#bake}.
 *
 * @param status  Outcome
 * @param content Baked content, or the original content when the bake failed
 * @param report  Analysis report, null when the bake failed
 * @param error   Failure description, null unless the bake failed
 */
public record BakeResult(
        BakeStatus status,
        String content,
        AnalysisReport report,
        String error) {

    public static BakeResult of(AnalysisReport report) {
        BakeStatus status = report.fixesApplied() > 0 ? BakeStatus.MARKED : BakeStatus.UNCHANGED;
        return new BakeResult(status, report.patchedContent(), report, null);
    }

    public static BakeResult failed(String originalContent, String error) {
        return new BakeResult(BakeStatus.FAILED, originalContent, null, error);
    }

    public boolean isFailed() {
        return status == BakeStatus.FAILED;
    }
}
