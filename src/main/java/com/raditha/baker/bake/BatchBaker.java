package com.raditha.baker.bake;

import com.raditha.baker.analysis.NamespaceException;
import com.raditha.baker.analyzer.AnalysisReport;
import com.raditha.baker.analyzer.DeterminismAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Analyses many files, optionally in parallel. Each file gets its own token
 * stream, fixer and walker; only the analyzer's catalogue is shared.
 */
public class BatchBaker {

    private static final Logger logger = LoggerFactory.getLogger(BatchBaker.class);

    private final DeterminismAnalyzer analyzer;
    private final int threads;

    public BatchBaker(DeterminismAnalyzer analyzer, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
        }
        this.analyzer = analyzer;
        this.threads = threads;
    }

    /**
     * Analyse files and return one outcome per file, in input order.
     * Namespace failures are recorded per file and do not stop the batch.
     *
     * @param files   files to analyse
     * @param fixMode true to compute patched content
     * @throws IOException          if a file cannot be read
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public List<UnitOutcome> analyzeAll(List<Path> files, boolean fixMode)
            throws IOException, InterruptedException {
        if (threads == 1 || files.size() < 2) {
            List<UnitOutcome> outcomes = new ArrayList<>();
            for (Path file : files) {
                outcomes.add(analyzeOne(file, fixMode));
            }
            return outcomes;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, files.size()));
        try {
            List<Future<UnitOutcome>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> analyzeOne(file, fixMode)));
            }
            List<UnitOutcome> outcomes = new ArrayList<>();
            for (Future<UnitOutcome> future : futures) {
                outcomes.add(unwrap(future));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Write patched content back for every changed file.
     *
     * @return number of files written
     * @throws IOException if a file cannot be written
     */
    public int writeChanges(List<UnitOutcome> outcomes) throws IOException {
        int written = 0;
        for (UnitOutcome outcome : outcomes) {
            AnalysisReport report = outcome.report();
            if (report != null && report.isChanged()) {
                Files.writeString(outcome.file(), report.patchedContent(), DeterminismAnalyzer.SOURCE_CHARSET);
                logger.info("Wrote {} marker(s) to {}", report.fixesApplied(), outcome.file());
                written++;
            }
        }
        return written;
    }

    private UnitOutcome analyzeOne(Path file, boolean fixMode) throws IOException {
        try {
            return UnitOutcome.success(file, analyzer.analyzeFile(file, fixMode));
        } catch (NamespaceException e) {
            logger.warn("Cannot bake {}: {}", file, e.getMessage());
            return UnitOutcome.failure(file, e.getMessage());
        }
    }

    private static UnitOutcome unwrap(Future<UnitOutcome> future) throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Analysis failed", cause);
        }
    }
}
