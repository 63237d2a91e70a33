package com.raditha.baker.fix;

import com.raditha.baker.model.TokenKind;
import com.raditha.baker.tokenizer.PhpTokenizer;
import com.raditha.baker.tokenizer.TokenStream;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarkerCallTest {

    private boolean hasMarker(String source) {
        TokenStream stream = new PhpTokenizer().tokenize(source);
        for (int i = 0; i < stream.size(); i++) {
            if (MarkerCall.isMarkerAt(stream, i)) {
                return true;
            }
        }
        return false;
    }

    @Test
    void testStatement() {
        assertEquals("Acme\\Shop\\framework\\Cache::noCache();", MarkerCall.statement("Acme\\Shop"));
    }

    @Test
    void testInsertedStatementIsRecognised() {
        assertTrue(hasMarker("<?php " + MarkerCall.statement("Acme\\Shop")));
    }

    @Test
    void testRecognisedWithAnyQualifier() {
        assertTrue(hasMarker("<?php Cache::noCache();"));
        assertTrue(hasMarker("<?php \\Other\\Pkg\\framework\\Cache :: noCache();"));
    }

    @Test
    void testOtherCallsAreNotMarkers() {
        assertFalse(hasMarker("<?php Cache::clear();"));
        assertFalse(hasMarker("<?php Cache->noCache();"));
        assertFalse(hasMarker("<?php noCache();"));
        assertFalse(hasMarker("<?php $s = 'Cache::noCache()';"));
    }

    @Test
    void testMarkerAtEndOfStream() {
        TokenStream stream = new PhpTokenizer().tokenize("<?php Cache");
        int cache = stream.findNext(TokenKind.IDENTIFIER, 0, stream.size());
        assertFalse(MarkerCall.isMarkerAt(stream, cache));
    }
}
