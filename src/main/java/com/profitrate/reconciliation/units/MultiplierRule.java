package com.profitrate.reconciliation.units;

import com.profitrate.reconciliation.core.model.Unit;

import java.util.Objects;

/**
 * Scales a value by a fixed factor, e.g. millions to billions by 0.001.
 */
public record MultiplierRule(Unit from, Unit to, double factor, String variableId) implements ConversionRule {

    public MultiplierRule {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        if (factor == 0 || Double.isNaN(factor) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("factor must be finite and non-zero, got " + factor);
        }
    }

    public MultiplierRule(Unit from, Unit to, double factor) {
        this(from, to, factor, null);
    }

    @Override
    public double apply(double value) {
        return value * factor;
    }

    @Override
    public String describe() {
        return from + " -> " + to + " x" + factor;
    }
}
