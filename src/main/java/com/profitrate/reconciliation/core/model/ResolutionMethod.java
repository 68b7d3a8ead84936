package com.profitrate.reconciliation.core.model;

/**
 * How the value at a given year of a {@link VariableSeries} was obtained.
 */
public enum ResolutionMethod {
    /** Exactly one source reported the year. */
    NATIVE("native"),
    /** Several sources reported the year; the priority order chose one. */
    MERGED("merged"),
    /** Filled by bounded linear interpolation. */
    GAP_FILLED_LINEAR("gap-filled:linear"),
    /** Explicit, rationale-bearing substitution. */
    MANUAL_OVERRIDE("manual-override"),
    /** Computed from other variables by a declared formula. */
    DERIVED("derived");

    private final String label;

    ResolutionMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * True for values that did not come from a source observation.
     */
    public boolean isFilled() {
        return this == GAP_FILLED_LINEAR || this == MANUAL_OVERRIDE;
    }

    @Override
    public String toString() {
        return label;
    }
}
