package com.raditha.baker.analysis;

import com.raditha.baker.model.Token;
import com.raditha.baker.model.TokenKind;
import com.raditha.baker.tokenizer.TokenStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the two-segment namespace prefix (e.g. {@code Vendor\Package}) that
 * qualifies the marker call.
 */
public class NamespaceResolver {

    private static final String SEPARATOR = "\\";

    /**
     * Scan forward for a namespace declaration and keep its first two segments.
     *
     * @param stream    token stream of the unit
     * @param fromIndex first index to inspect
     * @return the two-segment namespace
     * @throws MissingNamespaceException    if the unit declares no namespace
     * @throws IncompleteNamespaceException if the declaration has fewer than two segments
     */
    public String resolve(TokenStream stream, int fromIndex) {
        int index = fromIndex;
        while (true) {
            int keyword = stream.findNext(TokenKind.NAMESPACE, index, stream.size());
            if (keyword == TokenStream.NO_MATCH) {
                throw new MissingNamespaceException();
            }
            int next = stream.nextNonEmpty(keyword + 1, stream.size());
            // namespace\foo() is a relative name, not a declaration.
            if (next != TokenStream.NO_MATCH && stream.get(next).kind() == TokenKind.NS_SEPARATOR) {
                index = next + 1;
                continue;
            }
            return twoSegments(readDeclaration(stream, keyword + 1));
        }
    }

    /**
     * Reduce an explicitly supplied namespace to its first two segments.
     *
     * @throws IncompleteNamespaceException if fewer than two segments are present
     */
    public String normalize(String namespace) {
        List<String> segments = new ArrayList<>();
        for (String part : namespace.split("\\\\")) {
            if (!part.isBlank()) {
                segments.add(part.trim());
            }
        }
        if (segments.size() < 2) {
            throw new IncompleteNamespaceException(namespace);
        }
        return segments.get(0) + SEPARATOR + segments.get(1);
    }

    /**
     * Collect name segments of a declaration up to its terminating {@code ;} or {@code {}.
     */
    private List<String> readDeclaration(TokenStream stream, int from) {
        List<String> segments = new ArrayList<>();
        for (int i = from; i < stream.size(); i++) {
            Token token = stream.get(i);
            if (token.isEmpty() || token.kind() == TokenKind.NS_SEPARATOR) {
                continue;
            }
            if (token.kind() != TokenKind.IDENTIFIER) {
                break;
            }
            segments.add(token.text());
        }
        return segments;
    }

    private String twoSegments(List<String> segments) {
        if (segments.size() < 2) {
            throw new IncompleteNamespaceException(String.join(SEPARATOR, segments));
        }
        return segments.get(0) + SEPARATOR + segments.get(1);
    }
}
