package com.raditha.baker.tokenizer;

import com.raditha.baker.model.Token;
import com.raditha.baker.model.TokenKind;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Immutable token stream with pairing computed once at construction.
 * Brackets, parentheses and braces are paired with a stack; routine and
 * closure keywords are linked to the brace that opens their body.
 */
public final class PhpTokenStream implements TokenStream {

    private final List<Token> tokens;
    private final int[] partner;
    private final int[] scopeOpener;

    public PhpTokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        this.partner = new int[this.tokens.size()];
        this.scopeOpener = new int[this.tokens.size()];
        Arrays.fill(partner, NO_MATCH);
        Arrays.fill(scopeOpener, NO_MATCH);
        pairDelimiters();
        linkScopes();
    }

    @Override
    public int size() {
        return tokens.size();
    }

    @Override
    public Token get(int index) {
        return tokens.get(index);
    }

    @Override
    public int closerOf(int openerIndex) {
        if (openerIndex < 0 || openerIndex >= tokens.size()) {
            return NO_MATCH;
        }
        if (!tokens.get(openerIndex).kind().isOpener()) {
            return NO_MATCH;
        }
        return partner[openerIndex];
    }

    /**
     * Index of the opener matching the closer at {@code closerIndex}.
     */
    public int openerOf(int closerIndex) {
        if (closerIndex < 0 || closerIndex >= tokens.size()) {
            return NO_MATCH;
        }
        if (!tokens.get(closerIndex).kind().isCloser()) {
            return NO_MATCH;
        }
        return partner[closerIndex];
    }

    @Override
    public int scopeOpenerOf(int keywordIndex) {
        if (keywordIndex < 0 || keywordIndex >= tokens.size()) {
            return NO_MATCH;
        }
        return scopeOpener[keywordIndex];
    }

    private void pairDelimiters() {
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind.isOpener()) {
                open.push(i);
            } else if (kind.isCloser()) {
                TokenKind expected = openerFor(kind);
                if (!containsKind(open, expected)) {
                    // Stray closer, leave it unpaired.
                    continue;
                }
                // Openers skipped here are never closed.
                while (tokens.get(open.peek()).kind() != expected) {
                    open.pop();
                }
                int opener = open.pop();
                partner[opener] = i;
                partner[i] = opener;
            }
        }
    }

    private boolean containsKind(Deque<Integer> open, TokenKind kind) {
        for (int index : open) {
            if (tokens.get(index).kind() == kind) {
                return true;
            }
        }
        return false;
    }

    private static TokenKind openerFor(TokenKind closer) {
        return switch (closer) {
            case CLOSE_PARENTHESIS -> TokenKind.OPEN_PARENTHESIS;
            case CLOSE_BRACKET -> TokenKind.OPEN_BRACKET;
            case CLOSE_CURLY -> TokenKind.OPEN_CURLY;
            default -> throw new IllegalArgumentException("Not a closer: " + closer);
        };
    }

    private void linkScopes() {
        for (int i = 0; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind == TokenKind.FUNCTION || kind == TokenKind.CLOSURE) {
                scopeOpener[i] = findBodyOpener(i);
            }
        }
    }

    /**
     * Locate the body brace of a routine: first the parameter list, then the
     * first {@code {} after it, jumping over a closure {@code use (...)} clause.
     * A {@code ;} first means the declaration has no body.
     */
    private int findBodyOpener(int keywordIndex) {
        int params = NO_MATCH;
        for (int i = keywordIndex + 1; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind == TokenKind.OPEN_PARENTHESIS) {
                params = i;
                break;
            }
            if (kind == TokenKind.SEMICOLON || kind == TokenKind.OPEN_CURLY) {
                return NO_MATCH;
            }
        }
        if (params == NO_MATCH || partner[params] == NO_MATCH) {
            return NO_MATCH;
        }

        for (int i = partner[params] + 1; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind == TokenKind.OPEN_CURLY) {
                return i;
            }
            if (kind == TokenKind.SEMICOLON) {
                return NO_MATCH;
            }
            if (kind == TokenKind.OPEN_PARENTHESIS) {
                if (partner[i] == NO_MATCH) {
                    return NO_MATCH;
                }
                i = partner[i];
            }
        }
        return NO_MATCH;
    }
}
