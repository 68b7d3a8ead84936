package com.profitrate.reconciliation.identity;

/**
 * Outcome of comparing an identity's expected value with the observed one.
 */
public enum Classification {
    MATCH("match"),
    WITHIN_TOLERANCE("within-tolerance"),
    FLAGGED("flagged");

    private final String label;

    Classification(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Classifies an error. A NaN relative error never satisfies the relative bound.
     */
    public static Classification of(double absoluteError, double relativeError, Tolerance tolerance) {
        if (absoluteError == 0.0) {
            return MATCH;
        }
        if (absoluteError <= tolerance.absolute()
                || (!Double.isNaN(relativeError) && relativeError <= tolerance.relative())) {
            return WITHIN_TOLERANCE;
        }
        return FLAGGED;
    }
}
