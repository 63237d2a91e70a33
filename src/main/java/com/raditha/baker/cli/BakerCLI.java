package com.raditha.baker.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.baker.analysis.NamespaceException;
import com.raditha.baker.analyzer.AnalysisReport;
import com.raditha.baker.analyzer.DeterminismAnalyzer;
import com.raditha.baker.bake.BatchBaker;
import com.raditha.baker.bake.SourceFileFinder;
import com.raditha.baker.bake.UnitOutcome;
import com.raditha.baker.config.BakerConfig;
import com.raditha.baker.config.BakerSettings;
import com.raditha.baker.fix.DiffGenerator;
import com.raditha.baker.metrics.MetricsExporter;
import com.raditha.baker.model.Diagnostic;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the cache baker.
 * <p>
 * Usage:
 * java -jar baker.jar [options] &lt;file-or-directory&gt;...
 * <p>
 * Configuration priority: CLI arguments > baker.yml > defaults
 * <p>
 * Exit codes: 0 clean or fixed, 1 findings in check mode, 2 configuration
 * error, 3 I/O error, 4 namespace failure, 5 interrupted.
 */
@Command(name = "baker", mixinStandardHelpOptions = true, version = "Baker v1.0.0",
        description = "Marks PHP scopes with non-deterministic calls as uncacheable")
public class BakerCLI implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_NAMESPACE = 4;
    static final int EXIT_INTERRUPTED = 5;

    private static final String VERSION = "1.0.0";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    private CommandSpec spec;

    @Option(names = "--mode", description = "Run mode: check, fix or dry-run (default: check)",
            paramLabel = "<mode>", converter = BakeModeConverter.class)
    private BakeMode mode = BakeMode.CHECK;

    @Option(names = "--namespace", description = "Namespace prefix for inserted markers, e.g. Vendor\\Package",
            paramLabel = "<ns>")
    private String namespace;

    @Option(names = "--strip-open-tag", description = "Remove the first open tag from baked output")
    private Boolean stripOpenTag;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--threads", description = "Number of files analysed in parallel (default: 1)",
            paramLabel = "<n>")
    private int threads = 1;

    @Parameters(arity = "1..*", paramLabel = "<path>", description = "PHP files or directories to process")
    private List<Path> paths = new ArrayList<>();

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        BakerConfig config = BakerSettings.loadConfig(
                configFile == null ? null : Paths.get(configFile), namespace, stripOpenTag);

        List<Path> files = new SourceFileFinder(config).find(paths);
        BatchBaker batch = new BatchBaker(new DeterminismAnalyzer(config), threads);
        List<UnitOutcome> outcomes = batch.analyzeAll(files, mode.isFixing());

        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            printJsonReport(out, outcomes);
        } else {
            printTextReport(out, outcomes);
        }

        if (mode == BakeMode.FIX) {
            int written = batch.writeChanges(outcomes);
            if (!jsonOutput) {
                out.printf("%d file(s) rewritten%n", written);
            }
        } else if (mode == BakeMode.DRY_RUN && !jsonOutput) {
            printDiffs(out, outcomes);
        }
        out.flush();

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(outcomes);
        }

        if (outcomes.stream().anyMatch(UnitOutcome::isFailed)) {
            return EXIT_NAMESPACE;
        }
        boolean findings = outcomes.stream().anyMatch(o -> o.getDiagnosticCount() > 0);
        return mode == BakeMode.CHECK && findings ? EXIT_FINDINGS : EXIT_OK;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the command line with exit code mapping for execution errors.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new BakerCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof NamespaceException) {
                commandLine.getErr().println("Namespace error: " + ex.getMessage());
                return EXIT_NAMESPACE;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                Thread.currentThread().interrupt();
                return EXIT_INTERRUPTED;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_FINDINGS;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIG;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threads < 1) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
            exportFormat = format;
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
            if (!outputDir.exists() && !outputDir.mkdirs()) {
                throw new IllegalArgumentException("Cannot create output directory: " + outputPath);
            }
        }
    }

    private void printTextReport(PrintWriter out, List<UnitOutcome> outcomes) {
        int totalFindings = outcomes.stream().mapToInt(UnitOutcome::getDiagnosticCount).sum();

        out.println("=".repeat(80));
        out.println("CACHE BAKER REPORT (" + mode.toCliString() + ")");
        out.println("=".repeat(80));
        out.println();
        out.printf("Files analyzed: %d%n", outcomes.size());
        out.printf("Dynamic calls found: %d%n", totalFindings);
        out.println();

        for (UnitOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                out.println("FAILED " + outcome.file() + ": " + outcome.error());
                continue;
            }
            AnalysisReport report = outcome.report();
            if (!report.hasDiagnostics() && !report.malformed()) {
                continue;
            }
            out.println("-".repeat(80));
            out.print(report.getDetailedReport());
        }

        if (totalFindings == 0) {
            out.println("✓ No dynamic calls found!");
        }
        out.println();
    }

    private void printDiffs(PrintWriter out, List<UnitOutcome> outcomes) {
        DiffGenerator diffGenerator = new DiffGenerator();
        for (UnitOutcome outcome : outcomes) {
            AnalysisReport report = outcome.report();
            if (report != null && report.isChanged()) {
                out.println(diffGenerator.generateUnifiedDiff(
                        outcome.file(), report.originalContent(), report.patchedContent()));
            }
        }
    }

    /**
     * JSON view of one file's findings.
     */
    public record FileReport(String path, int findings, int markers, boolean malformed, String error,
            List<DiagnosticReport> diagnostics) {
    }

    public record DiagnosticReport(String code, String function, int line, int column, String message, boolean fixed) {
    }

    public record JsonReport(String version, String mode, int filesAnalyzed, int totalFindings, List<FileReport> files) {
    }

    private void printJsonReport(PrintWriter out, List<UnitOutcome> outcomes) throws JsonProcessingException {
        List<FileReport> files = outcomes.stream().map(BakerCLI::toFileReport).toList();
        JsonReport report = new JsonReport(
                VERSION,
                mode.toCliString(),
                outcomes.size(),
                files.stream().mapToInt(FileReport::findings).sum(),
                files);
        out.println(mapper.writeValueAsString(report));
    }

    private static FileReport toFileReport(UnitOutcome outcome) {
        AnalysisReport report = outcome.report();
        if (report == null) {
            return new FileReport(outcome.file().toString(), 0, 0, false, outcome.error(), List.of());
        }
        List<DiagnosticReport> diagnostics = new ArrayList<>();
        for (Diagnostic d : report.diagnostics()) {
            diagnostics.add(new DiagnosticReport(
                    d.code().source(), d.callName(), d.line(), d.column(), d.message(), d.fixed()));
        }
        return new FileReport(outcome.file().toString(), report.getDiagnosticCount(), report.fixesApplied(),
                report.malformed(), null, diagnostics);
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(List<UnitOutcome> outcomes) throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        Path first = paths.get(0).toAbsolutePath().normalize();
        String projectName = first.getFileName() != null ? first.getFileName().toString() : "project";

        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(outcomes, projectName);

        Path outputDir = outputPath != null ? Paths.get(outputPath) : Paths.get(".");
        PrintWriter err = spec.commandLine().getErr();

        if ("csv".equals(exportFormat) || "both".equals(exportFormat)) {
            Path csvPath = outputDir.resolve("baker-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            err.println("✓ Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(exportFormat) || "both".equals(exportFormat)) {
            Path jsonPath = outputDir.resolve("baker-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            err.println("✓ Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }

    /**
     * Custom converter for BakeMode enum to handle CLI string values.
     */
    public static class BakeModeConverter implements ITypeConverter<BakeMode> {
        @Override
        public BakeMode convert(String value) throws Exception {
            return BakeMode.fromString(value);
        }
    }
}
