package com.raditha.baker.model;

/**
 * Result of classifying a single call site.
 * Counts that do not apply to the kind are -1.
 *
 * @param kind     Verdict category
 * @param actual   Number of arguments written at the call site
 * @param required Number of arguments that makes the call static
 */
public record Verdict(
        VerdictKind kind,
        int actual,
        int required) {

    private static final Verdict CLEAR = new Verdict(VerdictKind.CLEAR, -1, -1);
    private static final Verdict ALWAYS_DYNAMIC = new Verdict(VerdictKind.ALWAYS_DYNAMIC, -1, -1);
    private static final Verdict ALREADY_MARKED = new Verdict(VerdictKind.ALREADY_MARKED, -1, -1);

    public static Verdict clear() {
        return CLEAR;
    }

    public static Verdict alwaysDynamic() {
        return ALWAYS_DYNAMIC;
    }

    public static Verdict alreadyMarked() {
        return ALREADY_MARKED;
    }

    public static Verdict insufficientArguments(int actual, int required) {
        return new Verdict(VerdictKind.INSUFFICIENT_ARGUMENTS, actual, required);
    }

    public static Verdict unknownArgumentCount(int required) {
        return new Verdict(VerdictKind.UNKNOWN_ARGUMENT_COUNT, -1, required);
    }

    /**
     * Check if this verdict makes the enclosing scope non-deterministic.
     */
    public boolean isDynamic() {
        return switch (kind) {
            case ALWAYS_DYNAMIC, INSUFFICIENT_ARGUMENTS, UNKNOWN_ARGUMENT_COUNT -> true;
            case CLEAR, ALREADY_MARKED -> false;
        };
    }
}
