package com.raditha.baker.tokenizer;

import com.raditha.baker.model.Token;
import com.raditha.baker.model.TokenKind;

/**
 * Ordered tokens of one source unit together with paired-delimiter metadata.
 * <p>
 * Implementations precompute the pairing so that walkers can jump across a
 * balanced group in constant time instead of counting nesting themselves.
 */
public interface TokenStream {

    /**
     * Returned when a delimiter or scope has no partner.
     */
    int NO_MATCH = -1;

    int size();

    Token get(int index);

    /**
     * Index of the closer matching the opener at {@code openerIndex}.
     *
     * @return the closer index, or {@link #NO_MATCH} if the group is never closed
     *         or the token is not an opener
     */
    int closerOf(int openerIndex);

    /**
     * Index of the {@code {} that opens the body of the routine or closure whose
     * keyword sits at {@code keywordIndex}.
     *
     * @return the opener index, or {@link #NO_MATCH} for declarations without a body
     */
    int scopeOpenerOf(int keywordIndex);

    /**
     * Find the next token that is not whitespace or a comment.
     *
     * @param from  first index to inspect
     * @param limit index to stop before (exclusive)
     * @return the index, or {@link #NO_MATCH} if none exists before {@code limit}
     */
    default int nextNonEmpty(int from, int limit) {
        int end = Math.min(limit, size());
        for (int i = Math.max(from, 0); i < end; i++) {
            if (!get(i).isEmpty()) {
                return i;
            }
        }
        return NO_MATCH;
    }

    /**
     * Find the nearest token before {@code from} that is not whitespace or a comment.
     *
     * @return the index, or {@link #NO_MATCH} if none exists
     */
    default int previousNonEmpty(int from) {
        for (int i = Math.min(from, size()) - 1; i >= 0; i--) {
            if (!get(i).isEmpty()) {
                return i;
            }
        }
        return NO_MATCH;
    }

    /**
     * Find the next token of the given kind.
     *
     * @param kind  kind to look for
     * @param from  first index to inspect
     * @param limit index to stop before (exclusive)
     * @return the index, or {@link #NO_MATCH}
     */
    default int findNext(TokenKind kind, int from, int limit) {
        int end = Math.min(limit, size());
        for (int i = Math.max(from, 0); i < end; i++) {
            if (get(i).kind() == kind) {
                return i;
            }
        }
        return NO_MATCH;
    }

    /**
     * Concatenated text of all tokens, i.e. the original source.
     */
    default String contents() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < size(); i++) {
            sb.append(get(i).text());
        }
        return sb.toString();
    }
}
