package com.raditha.baker.analysis;

/**
 * Thrown when an opened group has no matching closer, so the extent of a
 * scope or argument list cannot be trusted.
 */
public class MalformedScopeBoundaryException extends RuntimeException {

    private final int openerIndex;

    public MalformedScopeBoundaryException(int openerIndex, String text, int line) {
        super(String.format("No closer found for '%s' opened at line %d (token %d)", text, line, openerIndex));
        this.openerIndex = openerIndex;
    }

    public int getOpenerIndex() {
        return openerIndex;
    }
}
