package com.raditha.baker.fix;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for dry-run previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between original and baked code.
     *
     * @param file     file the code belongs to, used for the diff headers
     * @param original code before baking
     * @param baked    code after baking
     * @return unified diff, empty if the code is unchanged
     */
    public String generateUnifiedDiff(Path file, String original, String baked) {
        return generateUnifiedDiff(file, original, baked, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(Path file, String original, String baked, int contextLines) {
        if (original.equals(baked)) {
            return "";
        }
        List<String> originalLines = Arrays.asList(original.split("\n", -1));
        List<String> bakedLines = Arrays.asList(baked.split("\n", -1));

        Patch<String> patch = DiffUtils.diff(originalLines, bakedLines);

        String name = file == null ? "content" : file.toString();
        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + name,
                "b/" + name,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}
