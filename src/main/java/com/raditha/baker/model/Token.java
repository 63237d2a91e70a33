package com.raditha.baker.model;

/**
 * A single lexical token of a PHP source unit.
 *
 * @param kind   Lexical category
 * @param text   Exact source text of the token
 * @param line   Source line number (1-indexed)
 * @param column Source column number (1-indexed)
 */
public record Token(
        TokenKind kind,
        String text,
        int line,
        int column) {

    /**
     * Create a token without position information.
     */
    public Token(TokenKind kind, String text) {
        this(kind, text, 0, 0);
    }

    /**
     * Check if this token is whitespace or a comment.
     */
    public boolean isEmpty() {
        return kind.isEmpty();
    }

    /**
     * Check if this token is the given kind with the given text.
     */
    public boolean is(TokenKind expectedKind, String expectedText) {
        return kind == expectedKind && text.equals(expectedText);
    }
}
