package com.profitrate.reconciliation.gap;

import com.profitrate.reconciliation.core.ReconciliationException;

/**
 * Thrown when a manual override carries no rationale. Fatal for that override only.
 */
public class MissingRationaleException extends ReconciliationException {
    private final String variableId;
    private final int year;

    public MissingRationaleException(String variableId, int year) {
        super("Manual override of " + variableId + "@" + year + " requires a non-empty rationale");
        this.variableId = variableId;
        this.year = year;
    }

    public String getVariableId() {
        return variableId;
    }

    public int getYear() {
        return year;
    }
}
