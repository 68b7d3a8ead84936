package com.profitrate.reconciliation.identity;

import com.profitrate.reconciliation.core.ReconciliationException;

/**
 * Thrown when a declared formula cannot be parsed.
 */
public class FormulaParseException extends ReconciliationException {
    private final int position;

    public FormulaParseException(String formula, int position, String message) {
        super("Cannot parse formula '" + formula + "' at position " + position + ": " + message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
