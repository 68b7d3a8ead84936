package com.profitrate.reconciliation.identity;

/**
 * Whether a validation result rests only on source data or also on filled values.
 */
public enum ValidationBasis {
    NATIVE("native"),
    GAP_FILLED("gap-filled");

    private final String label;

    ValidationBasis(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
