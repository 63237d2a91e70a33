package com.raditha.baker.analysis;

/**
 * No namespace was supplied and the source declares none.
 */
public class MissingNamespaceException extends NamespaceException {

    public MissingNamespaceException() {
        super("No namespace given and no namespace declaration found in the source");
    }
}
