package com.raditha.baker.config;

import java.util.List;

/**
 * Configuration for a bake run.
 *
 * @param catalogue       Functions treated as non-deterministic
 * @param namespace       Namespace used to build the marker call; blank means
 *                        resolve it from each source file
 * @param stripOpenTag    Remove the first open tag so the output can be eval'd
 * @param excludePatterns File patterns to exclude (glob format)
 * @param extensions      File extensions picked up when scanning directories
 */
public record BakerConfig(
        DeterminismCatalogue catalogue,
        String namespace,
        boolean stripOpenTag,
        List<String> excludePatterns,
        List<String> extensions) {

    /**
     * Validate configuration.
     */
    public BakerConfig {
        if (catalogue == null) {
            throw new IllegalArgumentException("catalogue cannot be null");
        }
        if (namespace == null) {
            namespace = "";
        }
        if (excludePatterns == null) {
            excludePatterns = List.of();
        }
        if (extensions == null || extensions.isEmpty()) {
            extensions = defaultExtensions();
        }
        for (String extension : extensions) {
            if (extension.isBlank() || extension.startsWith(".")) {
                throw new IllegalArgumentException(
                        "extensions are given without a leading dot, got: '" + extension + "'");
            }
        }
    }

    /**
     * Default configuration: built-in catalogue, namespace resolved per file.
     */
    public static BakerConfig defaults() {
        return new BakerConfig(
                DeterminismCatalogue.defaults(),
                "",
                false, // stripOpenTag
                defaultExcludePatterns(),
                defaultExtensions());
    }

    public BakerConfig withNamespace(String newNamespace) {
        return new BakerConfig(catalogue, newNamespace, stripOpenTag, excludePatterns, extensions);
    }

    public BakerConfig withStripOpenTag(boolean strip) {
        return new BakerConfig(catalogue, namespace, strip, excludePatterns, extensions);
    }

    public boolean hasNamespace() {
        return !namespace.isBlank();
    }

    /**
     * Default file exclusion patterns.
     */
    private static List<String> defaultExcludePatterns() {
        return List.of(
                "**/vendor/**",
                "**/node_modules/**",
                "**/.git/**");
    }

    private static List<String> defaultExtensions() {
        return List.of("php", "inc");
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check if a file name carries one of the configured extensions.
     */
    public boolean hasSourceExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String extension = fileName.substring(dot + 1);
        return extensions.stream().anyMatch(extension::equalsIgnoreCase);
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards.
     */
    private boolean matchesGlobPattern(String path, String pattern) {
        String regex = pattern
                .replace(".", "\\.")
                .replace("**", "\u0000")
                .replace("*", "[^/]*")
                .replace("\u0000", ".*");
        return path.matches(regex);
    }
}
