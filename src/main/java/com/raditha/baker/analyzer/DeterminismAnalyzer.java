package com.raditha.baker.analyzer;

import com.raditha.baker.analysis.CallClassifier;
import com.raditha.baker.analysis.LazyNamespace;
import com.raditha.baker.analysis.NamespaceResolver;
import com.raditha.baker.analysis.ScopeWalker;
import com.raditha.baker.config.BakerConfig;
import com.raditha.baker.fix.FixEmitter;
import com.raditha.baker.fix.SourceFixer;
import com.raditha.baker.model.Scope;
import com.raditha.baker.model.TokenKind;
import com.raditha.baker.tokenizer.PhpTokenizer;
import com.raditha.baker.tokenizer.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Main orchestrator for determinism analysis of a single source unit.
 * Coordinates tokenizing, scope walking, fix emission and rendering.
 * <p>
 * Instances hold no per-unit state and may analyse several units concurrently.
 */
public class DeterminismAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DeterminismAnalyzer.class);

    /**
     * Charset for reading and writing source files. PHP syntax is ASCII, and
     * ISO-8859-1 maps every byte to one char, so files in any encoding are
     * rewritten byte for byte.
     */
    public static final Charset SOURCE_CHARSET = StandardCharsets.ISO_8859_1;

    private final BakerConfig config;
    private final CallClassifier classifier;
    private final NamespaceResolver namespaceResolver;

    /**
     * Create analyzer with default configuration.
     */
    public DeterminismAnalyzer() {
        this(BakerConfig.defaults());
    }

    /**
     * Create analyzer with custom configuration.
     */
    public DeterminismAnalyzer(BakerConfig config) {
        this.config = config;
        this.classifier = new CallClassifier(config.catalogue());
        this.namespaceResolver = new NamespaceResolver();
    }

    /**
     * Analyse a file on disk.
     *
     * @param sourceFile file to analyse
     * @param fixMode    true to insert markers into the returned content
     * @throws IOException if the file cannot be read
     * @throws com.raditha.baker.analysis.NamespaceException in fix mode when no namespace can be resolved
     */
    public AnalysisReport analyzeFile(Path sourceFile, boolean fixMode) throws IOException {
        return analyze(Files.readString(sourceFile, SOURCE_CHARSET), sourceFile, fixMode);
    }

    /**
     * Analyse source content.
     *
     * @param content    PHP source
     * @param sourceFile where the content came from, may be null
     * @param fixMode    true to insert markers into the returned content
     * @return analysis report with findings and patched content
     * @throws com.raditha.baker.analysis.NamespaceException in fix mode when no namespace can be resolved
     */
    public AnalysisReport analyze(String content, Path sourceFile, boolean fixMode) {
        TokenStream stream = new PhpTokenizer().tokenize(content);
        int openTag = stream.findNext(TokenKind.OPEN_TAG, 0, stream.size());
        if (openTag == TokenStream.NO_MATCH) {
            // Echo tags hold a single expression; a marker there would replace the echoed value.
            logger.debug("No <?php tag in {}, nothing to analyse", describe(sourceFile));
            return new AnalysisReport(sourceFile, List.of(), 0, 0, false, content, content);
        }

        SourceFixer fixer = new SourceFixer(stream);
        FixEmitter emitter = new FixEmitter(fixer, fixMode);
        ScopeWalker walker = new ScopeWalker(classifier, emitter);
        LazyNamespace namespace = config.hasNamespace()
                ? LazyNamespace.explicit(namespaceResolver, config.namespace())
                : LazyNamespace.fromSource(namespaceResolver, stream, openTag);

        walker.walk(stream, Scope.file(openTag, stream.size() - 1), namespace);

        if (fixMode && config.stripOpenTag()) {
            fixer.replaceToken(openTag, "");
        }

        String patched = fixMode ? fixer.getContents() : content;
        AnalysisReport report = new AnalysisReport(
                sourceFile,
                emitter.getDiagnostics(),
                emitter.getFixesApplied(),
                walker.getScopesVisited(),
                walker.isMalformed(),
                content,
                patched);
        logger.debug("{}: {}", describe(sourceFile), report.getSummary());
        return report;
    }

    public BakerConfig getConfig() {
        return config;
    }

    private static String describe(Path sourceFile) {
        return sourceFile == null ? "(content)" : sourceFile.toString();
    }
}
