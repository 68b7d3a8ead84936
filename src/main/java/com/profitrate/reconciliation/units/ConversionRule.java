package com.profitrate.reconciliation.units;

import com.profitrate.reconciliation.core.model.Unit;

/**
 * A declared conversion from one unit to another.
 * Rules are constants of the configuration; none is derived from the data.
 */
public interface ConversionRule {

    Unit from();

    Unit to();

    /**
     * Variable the rule is restricted to, or {@code null} when it applies to all variables.
     */
    String variableId();

    double apply(double value);

    /**
     * Human-readable form used in logs and the report.
     */
    String describe();
}
