package com.raditha.baker.model;

/**
 * Stable codes for dynamism findings.
 * The code strings are part of the report format and must not change.
 */
public enum DiagnosticCode {
    /** Call to a function that is always dynamic */
    FOUND("Found"),

    /** Call with fewer arguments than needed to be static */
    FOUND_POSSIBLE_STATIC("FoundPossibleStatic"),

    /** Call whose argument count is hidden by unpacking */
    FOUND_POSSIBLE_UNPACKED_STATIC("FoundPossibleUnpackedStatic");

    private static final String SOURCE_PREFIX = "PerspectiveCache.Functions.DynamicFunctions.";

    private final String code;

    DiagnosticCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Fully qualified source name, e.g. {@code PerspectiveCache.Functions.DynamicFunctions.Found}.
     */
    public String source() {
        return SOURCE_PREFIX + code;
    }

    /**
     * Map a dynamic verdict kind to its code.
     *
     * @throws IllegalArgumentException if the kind does not describe a finding
     */
    public static DiagnosticCode of(VerdictKind kind) {
        return switch (kind) {
            case ALWAYS_DYNAMIC -> FOUND;
            case INSUFFICIENT_ARGUMENTS -> FOUND_POSSIBLE_STATIC;
            case UNKNOWN_ARGUMENT_COUNT -> FOUND_POSSIBLE_UNPACKED_STATIC;
            case CLEAR, ALREADY_MARKED -> throw new IllegalArgumentException(
                    "Verdict " + kind + " is not a finding");
        };
    }
}
