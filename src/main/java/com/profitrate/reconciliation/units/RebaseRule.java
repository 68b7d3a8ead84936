package com.profitrate.reconciliation.units;

import com.profitrate.reconciliation.core.model.Unit;

import java.util.Objects;

/**
 * Rebases an index to a new base year: {@code value / baseValue * scale}.
 * {@code baseValue} is the declared level of the index in {@code baseYear}.
 */
public record RebaseRule(Unit from, Unit to, int baseYear, double baseValue, double scale,
                         String variableId) implements ConversionRule {

    public RebaseRule {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        if (baseValue == 0 || Double.isNaN(baseValue) || Double.isInfinite(baseValue)) {
            throw new IllegalArgumentException("baseValue must be finite and non-zero, got " + baseValue);
        }
        if (scale <= 0 || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("scale must be positive, got " + scale);
        }
    }

    @Override
    public double apply(double value) {
        return value / baseValue * scale;
    }

    @Override
    public String describe() {
        return from + " -> " + to + " rebased to " + baseYear + "=" + scale + " (base value " + baseValue + ")";
    }
}
