package com.raditha.baker.model;

/**
 * Outcome category of classifying one call site.
 */
public enum VerdictKind {
    /** Call is deterministic or not catalogued */
    CLEAR,

    /** Catalogued with no threshold: every call is dynamic */
    ALWAYS_DYNAMIC,

    /** Fewer arguments than the catalogued threshold */
    INSUFFICIENT_ARGUMENTS,

    /** Argument unpacking hides the real argument count */
    UNKNOWN_ARGUMENT_COUNT,

    /** The scope already contains an explicit marker call */
    ALREADY_MARKED
}
