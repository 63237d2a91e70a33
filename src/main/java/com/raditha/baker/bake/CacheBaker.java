package com.raditha.baker.bake;

import com.raditha.baker.analysis.NamespaceException;
import com.raditha.baker.analyzer.AnalysisReport;
import com.raditha.baker.analyzer.DeterminismAnalyzer;
import com.raditha.baker.config.BakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Bakes PHP code for cache integration: every scope that can produce
 * different output on different requests receives a marker statement so the
 * caching layer never caches it.
 */
public class CacheBaker {

    private static final Logger logger = LoggerFactory.getLogger(CacheBaker.class);

    private final BakerConfig config;

    public CacheBaker() {
        this(BakerConfig.defaults());
    }

    public CacheBaker(BakerConfig config) {
        this.config = config;
    }

    /**
     * Bake a file using the configured namespace and strip setting.
     *
     * @throws IOException if the file cannot be read
     */
    public BakeResult bake(Path filePath) throws IOException {
        return bake(null, filePath, config.stripOpenTag(), config.namespace());
    }

    /**
     * Run the determinism fixes on the content and return the modified content.
     *
     * @param content           the content to bake, or null to read {@code filePath}
     * @param filePath          file to read when no content is given
     * @param stripFirstOpenTag remove the first open tag so the result can be eval'd
     * @param namespace         namespace the code operates in; blank to read it from the source
     * @return the bake result; namespace failures are reported as {@link BakeStatus#FAILED}
     * @throws IOException if the content has to be read from a file that is missing or unreadable
     */
    public BakeResult bake(String content, Path filePath, boolean stripFirstOpenTag, String namespace)
            throws IOException {
        if (content == null) {
            if (filePath == null) {
                throw new IllegalArgumentException("Either content or a file path is required");
            }
            content = Files.readString(filePath);
        }

        BakerConfig unitConfig = config
                .withNamespace(namespace == null ? "" : namespace)
                .withStripOpenTag(stripFirstOpenTag);
        DeterminismAnalyzer analyzer = new DeterminismAnalyzer(unitConfig);

        try {
            AnalysisReport report = analyzer.analyze(content, filePath, true);
            return BakeResult.of(report);
        } catch (NamespaceException e) {
            logger.warn("Cannot bake {}: {}", filePath == null ? "content" : filePath, e.getMessage());
            return BakeResult.failed(content, e.getMessage());
        }
    }

    public BakerConfig getConfig() {
        return config;
    }
}
