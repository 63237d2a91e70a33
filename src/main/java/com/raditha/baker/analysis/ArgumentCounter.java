package com.raditha.baker.analysis;

import com.raditha.baker.model.Token;
import com.raditha.baker.model.TokenKind;
import com.raditha.baker.tokenizer.TokenStream;

/**
 * Counts the top-level arguments of a call without descending into nested
 * groups. Braces, brackets and parentheses inside the list are jumped over
 * using the stream's pairing, so commas inside them never count.
 */
public class ArgumentCounter {

    /**
     * Count arguments between a pair of parentheses.
     *
     * @param stream        token stream
     * @param argListStart  index of the opening parenthesis
     * @param argListEnd    index of the matching closing parenthesis
     * @return the count and whether unpacking was seen at the top level
     * @throws MalformedScopeBoundaryException if a nested group is never closed
     */
    public ArgumentCount count(TokenStream stream, int argListStart, int argListEnd) {
        int first = stream.nextNonEmpty(argListStart + 1, argListEnd);
        if (first == TokenStream.NO_MATCH) {
            return ArgumentCount.empty();
        }

        int count = 1;
        boolean hasUnpack = false;
        for (int i = argListStart + 1; i < argListEnd; i++) {
            Token token = stream.get(i);
            TokenKind kind = token.kind();
            if (kind.isOpener()) {
                int closer = stream.closerOf(i);
                if (closer == TokenStream.NO_MATCH || closer > argListEnd) {
                    throw new MalformedScopeBoundaryException(i, token.text(), token.line());
                }
                i = closer;
            } else if (kind == TokenKind.COMMA) {
                // A trailing comma does not start another argument.
                if (stream.nextNonEmpty(i + 1, argListEnd) != TokenStream.NO_MATCH) {
                    count++;
                }
            } else if (kind == TokenKind.ELLIPSIS) {
                hasUnpack = true;
            }
        }

        boolean callableReference = count == 1
                && stream.get(first).kind() == TokenKind.ELLIPSIS
                && stream.nextNonEmpty(first + 1, argListEnd) == TokenStream.NO_MATCH;
        if (callableReference) {
            return new ArgumentCount(0, false, true);
        }
        return new ArgumentCount(count, hasUnpack, false);
    }
}
