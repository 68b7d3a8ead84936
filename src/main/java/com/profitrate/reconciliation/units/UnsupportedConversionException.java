package com.profitrate.reconciliation.units;

import com.profitrate.reconciliation.core.ReconciliationException;
import com.profitrate.reconciliation.core.model.Unit;

/**
 * Thrown when a requested unit conversion is not declared in the conversion table.
 */
public class UnsupportedConversionException extends ReconciliationException {
    private final Unit from;
    private final Unit to;

    public UnsupportedConversionException(String variableId, Unit from, Unit to) {
        super("No declared conversion " + from + " -> " + to + " for variable '" + variableId + "'");
        this.from = from;
        this.to = to;
    }

    public Unit getFrom() {
        return from;
    }

    public Unit getTo() {
        return to;
    }
}
