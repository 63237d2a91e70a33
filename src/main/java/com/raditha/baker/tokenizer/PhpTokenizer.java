package com.raditha.baker.tokenizer;

import com.raditha.baker.model.Token;
import com.raditha.baker.model.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits PHP source text into tokens.
 * <p>
 * This is not a full PHP lexer. It recognises exactly what the determinism
 * analysis needs: tags, comments, strings (including heredoc and nowdoc),
 * names, delimiters and the handful of operators that change the meaning of
 * a call site. Concatenating the text of all tokens always reproduces the
 * input exactly.
 */
public class PhpTokenizer {

    private static final Set<String> KEYWORDS = Set.of(
            "abstract", "and", "array", "as", "break", "callable", "case", "catch",
            "class", "clone", "const", "continue", "declare", "default", "die", "do",
            "echo", "else", "elseif", "empty", "enddeclare", "endfor", "endforeach",
            "endif", "endswitch", "endwhile", "eval", "exit", "extends", "final",
            "finally", "for", "foreach", "global", "goto", "if", "implements",
            "include", "include_once", "instanceof", "insteadof", "interface", "isset",
            "list", "match", "or", "print", "private", "protected", "public",
            "require", "require_once", "return", "static", "switch", "throw", "trait",
            "try", "unset", "use", "var", "while", "xor", "yield");

    /** Longest first so that greedy matching works. */
    private static final List<String> OPERATORS = List.of(
            "<=>", "**=", "<<=", ">>=", "===", "!==", "??=",
            "<<", ">>", "<=", ">=", "==", "!=", "<>", "&&", "||", "??", "++", "--",
            "+=", "-=", "*=", "/=", ".=", "%=", "&=", "|=", "^=", "=>", "**");

    private String source;
    private int pos;
    private int line;
    private int column;
    private List<Token> tokens;

    /**
     * Tokenize a complete source unit.
     *
     * @param content PHP source, possibly with leading inline HTML
     * @return the token stream with pairing metadata
     */
    public TokenStream tokenize(String content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        this.source = content;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.tokens = new ArrayList<>();

        boolean inPhp = false;
        while (pos < source.length()) {
            if (inPhp) {
                inPhp = lexPhp();
            } else {
                inPhp = lexInlineHtml();
            }
        }
        return new PhpTokenStream(classifyFunctionKeywords(tokens));
    }

    /**
     * Consume text up to and including the next open tag.
     *
     * @return true once an open tag was emitted
     */
    private boolean lexInlineHtml() {
        int tag = findOpenTag(pos);
        if (tag < 0) {
            emit(TokenKind.INLINE_HTML, source.length());
            return false;
        }
        if (tag > pos) {
            emit(TokenKind.INLINE_HTML, tag);
        }
        if (source.startsWith("<?=", pos)) {
            emit(TokenKind.OPEN_TAG_WITH_ECHO, pos + 3);
            return true;
        }
        int end = pos + 5;
        if (source.startsWith("\r\n", end)) {
            end += 2;
        } else if (end < source.length() && Character.isWhitespace(source.charAt(end))) {
            end++;
        }
        emit(TokenKind.OPEN_TAG, end);
        return true;
    }

    private int findOpenTag(int from) {
        int i = source.indexOf("<?", from);
        while (i >= 0) {
            if (source.startsWith("<?=", i)) {
                return i;
            }
            if (source.regionMatches(true, i, "<?php", 0, 5)) {
                int after = i + 5;
                if (after >= source.length() || Character.isWhitespace(source.charAt(after))) {
                    return i;
                }
            }
            i = source.indexOf("<?", i + 2);
        }
        return -1;
    }

    /**
     * Consume one token of PHP code.
     *
     * @return false if a close tag switched back to inline HTML
     */
    private boolean lexPhp() {
        char c = source.charAt(pos);

        if (source.startsWith("?>", pos)) {
            int end = pos + 2;
            if (source.startsWith("\r\n", end)) {
                end += 2;
            } else if (end < source.length() && source.charAt(end) == '\n') {
                end++;
            }
            emit(TokenKind.CLOSE_TAG, end);
            return false;
        }
        if (Character.isWhitespace(c)) {
            int end = pos;
            while (end < source.length() && Character.isWhitespace(source.charAt(end))) {
                end++;
            }
            emit(TokenKind.WHITESPACE, end);
            return true;
        }
        if (c == '#' && source.startsWith("#[", pos)) {
            emit(TokenKind.OPEN_BRACKET, pos + 2);
            return true;
        }
        if (c == '#' || source.startsWith("//", pos)) {
            emit(TokenKind.COMMENT, lineCommentEnd());
            return true;
        }
        if (source.startsWith("/*", pos)) {
            int close = source.indexOf("*/", pos + 2);
            int end = close < 0 ? source.length() : close + 2;
            boolean doc = source.startsWith("/**", pos) && pos + 3 < source.length()
                    && Character.isWhitespace(source.charAt(pos + 3));
            emit(doc ? TokenKind.DOC_COMMENT : TokenKind.COMMENT, end);
            return true;
        }
        if (c == '\'' || c == '"' || c == '`') {
            emit(TokenKind.STRING_LITERAL, quotedEnd(c));
            return true;
        }
        if (source.startsWith("<<<", pos)) {
            int end = heredocEnd();
            if (end > 0) {
                emit(TokenKind.STRING_LITERAL, end);
                return true;
            }
        }
        if (c == '$' && pos + 1 < source.length() && isNameStart(source.charAt(pos + 1))) {
            emit(TokenKind.VARIABLE, nameEnd(pos + 1));
            return true;
        }
        if (isNameStart(c)) {
            int end = nameEnd(pos);
            emit(wordKind(source.substring(pos, end)), end);
            return true;
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length()
                && Character.isDigit(source.charAt(pos + 1)))) {
            emit(TokenKind.NUMBER, numberEnd());
            return true;
        }
        lexPunctuation(c);
        return true;
    }

    private void lexPunctuation(char c) {
        if (source.startsWith("...", pos)) {
            emit(TokenKind.ELLIPSIS, pos + 3);
        } else if (source.startsWith("::", pos)) {
            emit(TokenKind.DOUBLE_COLON, pos + 2);
        } else if (source.startsWith("?->", pos)) {
            emit(TokenKind.NULLSAFE_OBJECT_OPERATOR, pos + 3);
        } else if (source.startsWith("->", pos)) {
            emit(TokenKind.OBJECT_OPERATOR, pos + 2);
        } else {
            TokenKind single = switch (c) {
                case '(' -> TokenKind.OPEN_PARENTHESIS;
                case ')' -> TokenKind.CLOSE_PARENTHESIS;
                case '[' -> TokenKind.OPEN_BRACKET;
                case ']' -> TokenKind.CLOSE_BRACKET;
                case '{' -> TokenKind.OPEN_CURLY;
                case '}' -> TokenKind.CLOSE_CURLY;
                case ',' -> TokenKind.COMMA;
                case ';' -> TokenKind.SEMICOLON;
                case '\\' -> TokenKind.NS_SEPARATOR;
                default -> null;
            };
            if (single != null) {
                emit(single, pos + 1);
                return;
            }
            for (String op : OPERATORS) {
                if (source.startsWith(op, pos)) {
                    emit(TokenKind.OPERATOR, pos + op.length());
                    return;
                }
            }
            emit(TokenKind.OPERATOR, pos + 1);
        }
    }

    /**
     * Words directly after {@code ->}, {@code ::} or {@code function} are names,
     * even when they are spelled like reserved words.
     */
    private TokenKind wordKind(String word) {
        int previous = previousSignificant();
        if (previous >= 0) {
            TokenKind prevKind = tokens.get(previous).kind();
            if (prevKind == TokenKind.OBJECT_OPERATOR
                    || prevKind == TokenKind.NULLSAFE_OBJECT_OPERATOR
                    || prevKind == TokenKind.DOUBLE_COLON
                    || prevKind == TokenKind.FUNCTION) {
                return TokenKind.IDENTIFIER;
            }
        }
        String lower = word.toLowerCase(Locale.ROOT);
        return switch (lower) {
            case "function" -> TokenKind.FUNCTION;
            case "fn" -> TokenKind.FN;
            case "namespace" -> TokenKind.NAMESPACE;
            case "new" -> TokenKind.NEW;
            default -> KEYWORDS.contains(lower) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
        };
    }

    private int previousSignificant() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (!tokens.get(i).isEmpty()) {
                return i;
            }
        }
        return -1;
    }

    private int lineCommentEnd() {
        int end = pos;
        while (end < source.length()) {
            char ch = source.charAt(end);
            if (ch == '\n' || ch == '\r' || source.startsWith("?>", end)) {
                break;
            }
            end++;
        }
        return end;
    }

    private int quotedEnd(char quote) {
        int end = pos + 1;
        while (end < source.length()) {
            char ch = source.charAt(end);
            if (ch == '\\') {
                end += 2;
                continue;
            }
            end++;
            if (ch == quote) {
                break;
            }
        }
        return Math.min(end, source.length());
    }

    /**
     * End offset of a heredoc or nowdoc starting at {@code pos}, or -1 if the
     * text is not a valid heredoc header.
     */
    private int heredocEnd() {
        int i = pos + 3;
        while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i++;
        }
        char quote = 0;
        if (i < source.length() && (source.charAt(i) == '\'' || source.charAt(i) == '"')) {
            quote = source.charAt(i);
            i++;
        }
        if (i >= source.length() || !isNameStart(source.charAt(i))) {
            return -1;
        }
        int labelEnd = nameEnd(i);
        String label = source.substring(i, labelEnd);
        i = labelEnd;
        if (quote != 0) {
            if (i >= source.length() || source.charAt(i) != quote) {
                return -1;
            }
            i++;
        }
        int lineEnd = source.indexOf('\n', i);
        if (lineEnd < 0) {
            return -1;
        }

        int lineStart = lineEnd + 1;
        while (lineStart < source.length()) {
            int j = lineStart;
            while (j < source.length() && (source.charAt(j) == ' ' || source.charAt(j) == '\t')) {
                j++;
            }
            if (source.startsWith(label, j)) {
                int after = j + label.length();
                if (after >= source.length() || !isNamePart(source.charAt(after))) {
                    return after;
                }
            }
            int next = source.indexOf('\n', lineStart);
            if (next < 0) {
                break;
            }
            lineStart = next + 1;
        }
        return source.length();
    }

    private int nameEnd(int from) {
        int end = from;
        while (end < source.length() && isNamePart(source.charAt(end))) {
            end++;
        }
        return end;
    }

    private int numberEnd() {
        int end = pos;
        while (end < source.length()) {
            char ch = source.charAt(end);
            if ((ch == 'e' || ch == 'E') && end + 2 < source.length()
                    && (source.charAt(end + 1) == '+' || source.charAt(end + 1) == '-')
                    && Character.isDigit(source.charAt(end + 2))) {
                end += 2;
            } else if (ch == '.') {
                if (end + 1 >= source.length() || !Character.isDigit(source.charAt(end + 1))) {
                    break;
                }
            } else if (!Character.isLetterOrDigit(ch) && ch != '_') {
                break;
            }
            end++;
        }
        return end;
    }

    private static boolean isNameStart(char ch) {
        return ch == '_' || (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch >= 0x80;
    }

    private static boolean isNamePart(char ch) {
        return isNameStart(ch) || (ch >= '0' && ch <= '9');
    }

    private void emit(TokenKind kind, int end) {
        String text = source.substring(pos, end);
        tokens.add(new Token(kind, text, line, column));
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n') {
                line++;
                column = 1;
            } else if (ch != '\r') {
                column++;
            }
        }
        pos = end;
    }

    /**
     * A {@code function} keyword followed by its parameter list (optionally
     * after a by-reference {@code &}) starts a closure, not a named routine.
     */
    private static List<Token> classifyFunctionKeywords(List<Token> raw) {
        List<Token> result = new ArrayList<>(raw);
        for (int i = 0; i < result.size(); i++) {
            Token token = result.get(i);
            if (token.kind() != TokenKind.FUNCTION) {
                continue;
            }
            int next = nextSignificant(result, i + 1);
            if (next >= 0 && result.get(next).is(TokenKind.OPERATOR, "&")) {
                next = nextSignificant(result, next + 1);
            }
            if (next >= 0 && result.get(next).kind() == TokenKind.OPEN_PARENTHESIS) {
                result.set(i, new Token(TokenKind.CLOSURE, token.text(), token.line(), token.column()));
            }
        }
        return result;
    }

    private static int nextSignificant(List<Token> list, int from) {
        for (int i = from; i < list.size(); i++) {
            if (!list.get(i).isEmpty()) {
                return i;
            }
        }
        return -1;
    }
}
