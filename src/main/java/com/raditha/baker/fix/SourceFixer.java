package com.raditha.baker.fix;

import com.raditha.baker.tokenizer.TokenStream;

import java.util.Map;
import java.util.TreeMap;

/**
 * Records textual edits against token indices and renders the patched source.
 * <p>
 * Edits are addressed by positions in the original, pre-fix token layout and
 * are only applied when {@link #getContents()} renders the output, so index
 * arithmetic during analysis never sees shifted positions.
 */
public class SourceFixer {

    private final TokenStream stream;
    private final Map<Integer, String> replacements = new TreeMap<>();
    private final Map<Integer, StringBuilder> before = new TreeMap<>();
    private final Map<Integer, StringBuilder> after = new TreeMap<>();
    private int changeCount;

    public SourceFixer(TokenStream stream) {
        this.stream = stream;
    }

    /**
     * Append text directly after the token at {@code index}.
     */
    public void addContent(int index, String content) {
        checkIndex(index);
        after.computeIfAbsent(index, i -> new StringBuilder()).append(content);
        changeCount++;
    }

    /**
     * Insert text directly before the token at {@code index}.
     */
    public void addContentBefore(int index, String content) {
        checkIndex(index);
        before.computeIfAbsent(index, i -> new StringBuilder()).insert(0, content);
        changeCount++;
    }

    /**
     * Replace the text of the token at {@code index}. Content added before or
     * after the token is kept.
     */
    public void replaceToken(int index, String content) {
        checkIndex(index);
        replacements.put(index, content);
        changeCount++;
    }

    public boolean hasChanges() {
        return changeCount > 0;
    }

    public int getChangeCount() {
        return changeCount;
    }

    /**
     * Render the source with all recorded edits applied.
     */
    public String getContents() {
        if (!hasChanges()) {
            return stream.contents();
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < stream.size(); i++) {
            StringBuilder prefix = before.get(i);
            if (prefix != null) {
                sb.append(prefix);
            }
            sb.append(replacements.getOrDefault(i, stream.get(i).text()));
            StringBuilder suffix = after.get(i);
            if (suffix != null) {
                sb.append(suffix);
            }
        }
        return sb.toString();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= stream.size()) {
            throw new IndexOutOfBoundsException(
                    String.format("Token index %d outside stream of %d tokens", index, stream.size()));
        }
    }
}
