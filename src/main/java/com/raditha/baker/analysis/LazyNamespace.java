package com.raditha.baker.analysis;

import com.raditha.baker.tokenizer.TokenStream;

/**
 * Namespace for one source unit, determined at most once and only when a
 * marker actually has to be written. Check-only runs therefore never fail
 * on a missing or incomplete namespace.
 */
public class LazyNamespace {

    private final NamespaceResolver resolver;
    private final String explicit;
    private final TokenStream stream;
    private final int fromIndex;
    private String value;
    private int resolutions;

    private LazyNamespace(NamespaceResolver resolver, String explicit, TokenStream stream, int fromIndex) {
        this.resolver = resolver;
        this.explicit = explicit;
        this.stream = stream;
        this.fromIndex = fromIndex;
    }

    /**
     * Namespace supplied by the caller, normalized to two segments on first use.
     */
    public static LazyNamespace explicit(NamespaceResolver resolver, String namespace) {
        return new LazyNamespace(resolver, namespace, null, 0);
    }

    /**
     * Namespace read from the unit's declaration on first use.
     */
    public static LazyNamespace fromSource(NamespaceResolver resolver, TokenStream stream, int fromIndex) {
        return new LazyNamespace(resolver, null, stream, fromIndex);
    }

    /**
     * @throws NamespaceException if the namespace cannot be determined
     */
    public String get() {
        if (value == null) {
            resolutions++;
            value = explicit != null
                    ? resolver.normalize(explicit)
                    : resolver.resolve(stream, fromIndex);
        }
        return value;
    }

    public boolean isResolved() {
        return value != null;
    }

    /**
     * Number of times resolution was attempted.
     */
    public int getResolutions() {
        return resolutions;
    }
}
