package com.raditha.baker.model;

/**
 * A syntactic call site: an identifier followed by a balanced argument list.
 *
 * @param nameTokenIndex Index of the identifier token
 * @param argListStart   Index of the opening parenthesis
 * @param argListEnd     Index of the matching closing parenthesis
 */
public record Call(
        int nameTokenIndex,
        int argListStart,
        int argListEnd) {

    public Call {
        if (argListEnd <= argListStart) {
            throw new IllegalArgumentException("argument list must be a balanced group");
        }
    }
}
