package com.raditha.baker.model;

/**
 * Kind of lexical execution scope.
 * Each scope is cached independently by the downstream caching layer.
 */
public enum ScopeKind {
    /**
     * Top-level script body, starting at the first open tag.
     */
    FILE,

    /**
     * Body of a named function or method.
     */
    ROUTINE,

    /**
     * Body of an anonymous closure.
     */
    CLOSURE
}
