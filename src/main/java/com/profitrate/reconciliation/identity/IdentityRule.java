package com.profitrate.reconciliation.identity;

import java.util.List;
import java.util.Objects;

/**
 * A declared algebraic relationship, e.g. {@code r = SP / (K * u)}.
 * The formula gives the expected value; {@code observedVariable} names the series
 * holding the published value it is compared against.
 */
public final class IdentityRule {
    private final String name;
    private final Formula formula;
    private final String observedVariable;
    private final Tolerance tolerance;

    public IdentityRule(String name, Formula formula, String observedVariable, Tolerance tolerance) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.formula = Objects.requireNonNull(formula, "formula is required");
        this.observedVariable = Objects.requireNonNull(observedVariable, "observedVariable is required");
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance is required");
        if (formula.getVariables().contains(observedVariable)) {
            throw new IllegalArgumentException("Identity '" + name + "' uses its observed variable '"
                    + observedVariable + "' as an input");
        }
    }

    public static IdentityRule of(String name, String formula, String observedVariable, Tolerance tolerance) {
        return new IdentityRule(name, Formula.parse(formula), observedVariable, tolerance);
    }

    public String getName() {
        return name;
    }

    public Formula getFormula() {
        return formula;
    }

    public String getFormulaDescription() {
        return formula.getText();
    }

    /**
     * Input variables of the formula.
     */
    public List<String> getInputs() {
        return formula.getVariables();
    }

    public String getObservedVariable() {
        return observedVariable;
    }

    public Tolerance getTolerance() {
        return tolerance;
    }

    /**
     * Same rule with a different tolerance.
     */
    public IdentityRule withTolerance(Tolerance newTolerance) {
        return new IdentityRule(name, formula, observedVariable, newTolerance);
    }

    @Override
    public String toString() {
        return "IdentityRule{" + name + ": " + observedVariable + " = " + formula.getText()
                + ", tolerance=" + tolerance + '}';
    }
}
