package com.raditha.baker.fix;

import com.raditha.baker.model.Token;
import com.raditha.baker.model.TokenKind;
import com.raditha.baker.tokenizer.TokenStream;

/**
 * The statement that tells the caching layer never to cache a scope:
 * {@code Vendor\Package\framework\Cache::noCache();}
 */
public final class MarkerCall {

    public static final String FRAMEWORK_PATH = "framework";
    public static final String CLASS_NAME = "Cache";
    public static final String METHOD_NAME = "noCache";

    private MarkerCall() {
    }

    /**
     * Marker statement qualified with a two-segment namespace.
     */
    public static String statement(String namespace) {
        return namespace + "\\" + FRAMEWORK_PATH + "\\" + CLASS_NAME + "::" + METHOD_NAME + "();";
    }

    /**
     * Check if the token at {@code index} is the class name of a marker call,
     * i.e. {@code Cache} followed by {@code ::noCache}.
     */
    public static boolean isMarkerAt(TokenStream stream, int index) {
        Token token = stream.get(index);
        if (!token.is(TokenKind.IDENTIFIER, CLASS_NAME)) {
            return false;
        }
        int colon = stream.nextNonEmpty(index + 1, stream.size());
        if (colon == TokenStream.NO_MATCH || stream.get(colon).kind() != TokenKind.DOUBLE_COLON) {
            return false;
        }
        int method = stream.nextNonEmpty(colon + 1, stream.size());
        return method != TokenStream.NO_MATCH && stream.get(method).is(TokenKind.IDENTIFIER, METHOD_NAME);
    }
}
