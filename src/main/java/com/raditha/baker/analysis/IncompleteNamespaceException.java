package com.raditha.baker.analysis;

/**
 * The namespace has fewer than the two segments needed for the marker call.
 */
public class IncompleteNamespaceException extends NamespaceException {

    private final String namespace;

    public IncompleteNamespaceException(String namespace) {
        super("Expecting a namespace with at least 2 parts, got: '" + namespace + "'");
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }
}
