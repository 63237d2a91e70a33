package com.raditha.baker.model;

/**
 * A dynamism finding reported against a call site.
 *
 * @param code     Stable finding code
 * @param message  Human readable message
 * @param callName Function name as written in the source
 * @param line     Line of the call name token
 * @param column   Column of the call name token
 * @param fixed    True if a marker was inserted because of this finding
 */
public record Diagnostic(
        DiagnosticCode code,
        String message,
        String callName,
        int line,
        int column,
        boolean fixed) {

    /**
     * Format as {@code 12:5 message (Source.Code)} for display.
     */
    public String toDisplayString() {
        return String.format("%d:%d %s (%s)", line, column, message, code.source());
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
