package com.profitrate.reconciliation.derive;

import com.profitrate.reconciliation.core.model.Unit;
import com.profitrate.reconciliation.identity.Formula;

import java.util.Objects;

/**
 * A variable computed from other variables, e.g. {@code e = S / V}.
 */
public record DerivedVariable(String variableId, Formula formula, Unit unit) {

    public DerivedVariable {
        Objects.requireNonNull(variableId, "variableId is required");
        Objects.requireNonNull(formula, "formula is required");
        Objects.requireNonNull(unit, "unit is required");
        if (formula.getVariables().contains(variableId)) {
            throw new IllegalArgumentException("Derived variable '" + variableId + "' refers to itself");
        }
    }

    public static DerivedVariable of(String variableId, String formula, Unit unit) {
        return new DerivedVariable(variableId, Formula.parse(formula), unit);
    }

    /**
     * Source id recorded as the provenance of every derived value.
     */
    public String sourceId() {
        return "derived:" + variableId;
    }
}
