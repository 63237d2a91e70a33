package com.raditha.baker.model;

/**
 * Lexical category of a PHP token.
 * Only the categories the determinism analysis distinguishes get their own
 * constant; everything else collapses into {@link #OPERATOR}.
 */
public enum TokenKind {
    /** {@code <?php}, including one trailing whitespace character */
    OPEN_TAG,

    /** {@code <?=}, which echoes the expression that follows */
    OPEN_TAG_WITH_ECHO,

    /** {@code ?>} */
    CLOSE_TAG,

    /** Text outside of PHP tags */
    INLINE_HTML,

    WHITESPACE,

    /** Line, hash or block comment */
    COMMENT,

    /** {@code /** ... *}{@code /} comment */
    DOC_COMMENT,

    /** Bare name such as a function, class or constant name */
    IDENTIFIER,

    /** {@code $name} */
    VARIABLE,

    /** Named routine declaration keyword */
    FUNCTION,

    /** {@code function} keyword that starts an anonymous closure */
    CLOSURE,

    /** Arrow function keyword {@code fn} */
    FN,

    NAMESPACE,

    NEW,

    /** Any other reserved word */
    KEYWORD,

    /** Quoted string, heredoc or nowdoc */
    STRING_LITERAL,

    NUMBER,

    OPEN_PARENTHESIS,
    CLOSE_PARENTHESIS,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    OPEN_CURLY,
    CLOSE_CURLY,

    COMMA,
    SEMICOLON,

    /** Argument unpacking / variadic marker {@code ...} */
    ELLIPSIS,

    /** {@code ::} */
    DOUBLE_COLON,

    /** {@code ->} */
    OBJECT_OPERATOR,

    /** {@code ?->} */
    NULLSAFE_OBJECT_OPERATOR,

    /** {@code \} */
    NS_SEPARATOR,

    /** Other operators and punctuation */
    OPERATOR;

    /**
     * Whitespace and comments carry no meaning for the analysis.
     */
    public boolean isEmpty() {
        return this == WHITESPACE || this == COMMENT || this == DOC_COMMENT;
    }

    /**
     * Check if this kind opens a balanced group.
     */
    public boolean isOpener() {
        return this == OPEN_PARENTHESIS || this == OPEN_BRACKET || this == OPEN_CURLY;
    }

    /**
     * Check if this kind closes a balanced group.
     */
    public boolean isCloser() {
        return this == CLOSE_PARENTHESIS || this == CLOSE_BRACKET || this == CLOSE_CURLY;
    }
}
