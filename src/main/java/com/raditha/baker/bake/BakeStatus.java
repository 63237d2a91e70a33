package com.raditha.baker.bake;

/**
 * Outcome of baking one source unit.
 */
public enum BakeStatus {
    /**
     * Fully deterministic, no marker needed.
     */
    UNCHANGED,

    /**
     * At least one scope received a marker statement.
     */
    MARKED,

    /**
     * The unit could not be processed; the original content is returned.
     */
    FAILED
}
