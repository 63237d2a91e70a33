package com.raditha.baker.cli;

/**
 * Enumeration of run modes for the Baker CLI.
 */
public enum BakeMode {
    /**
     * Check mode - report every dynamic call without touching files.
     * This is the default mode.
     */
    CHECK,

    /**
     * Fix mode - insert marker statements and rewrite files in place.
     */
    FIX,

    /**
     * Dry-run mode - show a diff of what fix mode would change.
     */
    DRY_RUN;

    /**
     * Convert a string value to BakeMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding BakeMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static BakeMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("BakeMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "check" -> CHECK;
            case "fix" -> FIX;
            case "dry-run" -> DRY_RUN;
            default -> throw new IllegalArgumentException(
                    "Invalid bake mode: " + value + ". Must be: check, fix, or dry-run");
        };
    }

    /**
     * Get the string representation of this mode for CLI usage.
     */
    public String toCliString() {
        return switch (this) {
            case CHECK -> "check";
            case FIX -> "fix";
            case DRY_RUN -> "dry-run";
        };
    }

    /**
     * Check if markers are computed in this mode.
     */
    public boolean isFixing() {
        return this != CHECK;
    }
}
