package com.raditha.baker.analysis;

/**
 * Base class for failures to determine the namespace used in marker calls.
 * Fatal for the current source unit: no fix is applied.
 */
public abstract class NamespaceException extends RuntimeException {

    protected NamespaceException(String message) {
        super(message);
    }
}
