package com.raditha.baker.config;

import java.util.Locale;
import java.util.OptionalInt;

/**
 * Catalogue entry for a potentially non-deterministic function.
 *
 * @param name      Function name, stored in lower case
 * @param threshold Number of arguments that makes a call static, or null if
 *                  every call is dynamic
 */
public record DeterminismRule(
        String name,
        Integer threshold) {

    public DeterminismRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (threshold != null && threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1 for " + name);
        }
        name = name.toLowerCase(Locale.ROOT);
    }

    /**
     * Rule for a function that is dynamic regardless of its arguments.
     */
    public static DeterminismRule always(String name) {
        return new DeterminismRule(name, null);
    }

    /**
     * Rule for a function that becomes static once it receives {@code threshold}
     * arguments, e.g. an explicit timestamp.
     */
    public static DeterminismRule unlessArguments(String name, int threshold) {
        return new DeterminismRule(name, threshold);
    }

    public boolean isAlwaysDynamic() {
        return threshold == null;
    }

    public OptionalInt thresholdValue() {
        return threshold == null ? OptionalInt.empty() : OptionalInt.of(threshold);
    }
}
