package com.raditha.baker.analysis;

/**
 * Top-level argument count of a call site.
 *
 * @param count             Number of arguments written, 0 for an empty list
 * @param hasUnpack         True if a top-level {@code ...} makes the real count unknowable
 * @param callableReference True for {@code name(...)}, which creates a closure
 *                          instead of calling the function
 */
public record ArgumentCount(
        int count,
        boolean hasUnpack,
        boolean callableReference) {

    private static final ArgumentCount EMPTY = new ArgumentCount(0, false, false);

    public ArgumentCount {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
    }

    public static ArgumentCount empty() {
        return EMPTY;
    }
}
