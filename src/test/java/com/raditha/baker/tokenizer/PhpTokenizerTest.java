package com.raditha.baker.tokenizer;

import com.raditha.baker.model.Token;
import com.raditha.baker.model.TokenKind;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PhpTokenizerTest {

    private final PhpTokenizer tokenizer = new PhpTokenizer();

    private List<TokenKind> significantKinds(TokenStream stream) {
        List<TokenKind> kinds = new ArrayList<>();
        for (int i = 0; i < stream.size(); i++) {
            if (!stream.get(i).isEmpty()) {
                kinds.add(stream.get(i).kind());
            }
        }
        return kinds;
    }

    private int indexOf(TokenStream stream, TokenKind kind, String text) {
        for (int i = 0; i < stream.size(); i++) {
            if (stream.get(i).is(kind, text)) {
                return i;
            }
        }
        fail("No " + kind + " '" + text + "' in stream");
        return -1;
    }

    @Test
    void testSimpleCall() {
        TokenStream stream = tokenizer.tokenize("<?php echo time();");

        assertEquals(7, stream.size());
        assertEquals(new Token(TokenKind.OPEN_TAG, "<?php ", 1, 1), stream.get(0));
        assertEquals(TokenKind.KEYWORD, stream.get(1).kind());
        assertEquals(TokenKind.IDENTIFIER, stream.get(3).kind());
        assertEquals("time", stream.get(3).text());
        assertEquals(TokenKind.OPEN_PARENTHESIS, stream.get(4).kind());
        assertEquals(TokenKind.CLOSE_PARENTHESIS, stream.get(5).kind());
        assertEquals(TokenKind.SEMICOLON, stream.get(6).kind());
    }

    @Test
    void testInlineHtmlBeforeOpenTag() {
        TokenStream stream = tokenizer.tokenize("<html>\n<?php\n$a = 1;\n?>\n</html>");

        assertEquals(TokenKind.INLINE_HTML, stream.get(0).kind());
        assertEquals("<html>\n", stream.get(0).text());
        assertEquals(TokenKind.OPEN_TAG, stream.get(1).kind());
        assertEquals("<?php\n", stream.get(1).text());
        assertEquals(TokenKind.CLOSE_TAG, stream.get(stream.size() - 2).kind());
        assertEquals(TokenKind.INLINE_HTML, stream.get(stream.size() - 1).kind());
        assertEquals("</html>", stream.get(stream.size() - 1).text());
    }

    @Test
    void testNoOpenTag_AllInlineHtml() {
        TokenStream stream = tokenizer.tokenize("just text, time() is not code");

        assertEquals(1, stream.size());
        assertEquals(TokenKind.INLINE_HTML, stream.get(0).kind());
    }

    @Test
    void testShortEchoTag() {
        TokenStream stream = tokenizer.tokenize("<p><?= date('Y') ?></p>");

        assertEquals(TokenKind.OPEN_TAG_WITH_ECHO, stream.get(1).kind());
        assertEquals("<?=", stream.get(1).text());
    }

    @Test
    void testStringsAreSingleTokens() {
        TokenStream stream = tokenizer.tokenize("<?php $s = 'time()' . \"rand(\\\"x\\\")\" . `ls`;");

        assertEquals(List.of(TokenKind.OPEN_TAG, TokenKind.VARIABLE, TokenKind.OPERATOR,
                TokenKind.STRING_LITERAL, TokenKind.OPERATOR, TokenKind.STRING_LITERAL,
                TokenKind.OPERATOR, TokenKind.STRING_LITERAL, TokenKind.SEMICOLON),
                significantKinds(stream));
    }

    @Test
    void testHeredocAndNowdoc() {
        String source = "<?php\n$a = <<<EOT\nnow: time()\nEOT;\n$b = <<<'RAW'\n  rand()\n  RAW;\n";
        TokenStream stream = tokenizer.tokenize(source);

        long literals = significantKinds(stream).stream()
                .filter(k -> k == TokenKind.STRING_LITERAL)
                .count();
        assertEquals(2, literals);
        assertFalse(significantKinds(stream).contains(TokenKind.IDENTIFIER));
    }

    @Test
    void testComments() {
        TokenStream stream = tokenizer.tokenize("<?php // time()\n# rand()\n/* mt_rand() */\n/** doc */\nfoo();");

        assertEquals(List.of(TokenKind.OPEN_TAG, TokenKind.IDENTIFIER, TokenKind.OPEN_PARENTHESIS,
                TokenKind.CLOSE_PARENTHESIS, TokenKind.SEMICOLON), significantKinds(stream));
        assertEquals(TokenKind.DOC_COMMENT, stream.get(indexOf(stream, TokenKind.DOC_COMMENT, "/** doc */")).kind());
    }

    @Test
    void testLineCommentEndsAtCloseTag() {
        TokenStream stream = tokenizer.tokenize("<?php // note ?>tail");

        assertEquals(TokenKind.CLOSE_TAG, stream.get(stream.size() - 2).kind());
        assertEquals("tail", stream.get(stream.size() - 1).text());
    }

    @Test
    void testAttributeOpensBracket() {
        TokenStream stream = tokenizer.tokenize("<?php #[Pure] function f() {}");

        int attribute = indexOf(stream, TokenKind.OPEN_BRACKET, "#[");
        assertEquals(TokenKind.CLOSE_BRACKET, stream.get(stream.closerOf(attribute)).kind());
    }

    @Test
    void testMemberOperators() {
        TokenStream stream = tokenizer.tokenize("<?php $o->a(); $o?->b(); C::c();");

        assertTrue(significantKinds(stream).contains(TokenKind.OBJECT_OPERATOR));
        assertTrue(significantKinds(stream).contains(TokenKind.NULLSAFE_OBJECT_OPERATOR));
        assertTrue(significantKinds(stream).contains(TokenKind.DOUBLE_COLON));
    }

    @Test
    void testReservedWordAfterArrowIsIdentifier() {
        TokenStream stream = tokenizer.tokenize("<?php $o->list(); $o->function(); C::new();");

        assertEquals(TokenKind.IDENTIFIER, stream.get(indexOf(stream, TokenKind.IDENTIFIER, "list")).kind());
        assertEquals(TokenKind.IDENTIFIER, stream.get(indexOf(stream, TokenKind.IDENTIFIER, "function")).kind());
        assertEquals(TokenKind.IDENTIFIER, stream.get(indexOf(stream, TokenKind.IDENTIFIER, "new")).kind());
    }

    @Test
    void testFunctionKeywords() {
        TokenStream stream = tokenizer.tokenize(
                "<?php function named() {} $c = function () {}; $r = function &() {}; function &ref() {} $f = fn() => 1;");

        long routines = significantKinds(stream).stream().filter(k -> k == TokenKind.FUNCTION).count();
        long closures = significantKinds(stream).stream().filter(k -> k == TokenKind.CLOSURE).count();
        assertEquals(2, routines);
        assertEquals(2, closures);
        assertTrue(significantKinds(stream).contains(TokenKind.FN));
    }

    @Test
    void testNamespaceTokens() {
        TokenStream stream = tokenizer.tokenize("<?php namespace Acme\\Shop; \\time();");

        assertEquals(List.of(TokenKind.OPEN_TAG, TokenKind.NAMESPACE, TokenKind.IDENTIFIER,
                TokenKind.NS_SEPARATOR, TokenKind.IDENTIFIER, TokenKind.SEMICOLON, TokenKind.NS_SEPARATOR,
                TokenKind.IDENTIFIER, TokenKind.OPEN_PARENTHESIS, TokenKind.CLOSE_PARENTHESIS,
                TokenKind.SEMICOLON), significantKinds(stream));
    }

    @Test
    void testEllipsisAndNumbers() {
        TokenStream stream = tokenizer.tokenize("<?php f(...$a, 1.5e-3, 0x1F, .5);");

        assertTrue(significantKinds(stream).contains(TokenKind.ELLIPSIS));
        assertEquals(3, significantKinds(stream).stream().filter(k -> k == TokenKind.NUMBER).count());
    }

    @Test
    void testLineAndColumnTracking() {
        TokenStream stream = tokenizer.tokenize("<?php\n$a = 1;\n    time();");

        Token time = stream.get(indexOf(stream, TokenKind.IDENTIFIER, "time"));
        assertEquals(3, time.line());
        assertEquals(5, time.column());
    }

    @Test
    void testNullContent() {
        assertThrows(IllegalArgumentException.class, () -> tokenizer.tokenize(null));
    }

    @Test
    void testContentsReproduceSource() {
        String source = "<p>\n<?php\nnamespace A\\B;\n$x = <<<T\n{$y}\nT;\nfunction f(&$a, ...$b) { return [1, 2]; }\n?>\nend";
        assertEquals(source, tokenizer.tokenize(source).contents());
    }

    @Property
    void contentsAlwaysReproduceInput(@ForAll String text) {
        String source = "<?php " + text;
        assertEquals(source, tokenizer.tokenize(source).contents());
    }
}
