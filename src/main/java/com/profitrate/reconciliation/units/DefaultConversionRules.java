package com.profitrate.reconciliation.units;

import com.profitrate.reconciliation.core.model.Unit;

import java.util.List;

/**
 * Built-in conversions between currency scales and between percentages and fractions.
 * Index rebasing has no default; each index needs its own declared base value.
 */
public final class DefaultConversionRules {

    private DefaultConversionRules() {
        // Utility class
    }

    /**
     * Creates a table holding every default rule.
     */
    public static UnitConversionTable createDefaultTable() {
        return UnitConversionTable.builder()
                .rules(getCurrencyRules())
                .rules(getRatioRules())
                .build();
    }

    public static List<ConversionRule> getCurrencyRules() {
        return List.of(
                new MultiplierRule(Unit.CURRENCY_MILLIONS, Unit.CURRENCY_BILLIONS, 0.001),
                new MultiplierRule(Unit.CURRENCY_BILLIONS, Unit.CURRENCY_MILLIONS, 1000.0)
        );
    }

    public static List<ConversionRule> getRatioRules() {
        return List.of(
                new PercentToFractionRule(),
                new MultiplierRule(Unit.FRACTION, Unit.PERCENT, 100.0)
        );
    }

    /**
     * Divides by 100 rather than multiplying by 0.01 so that whole percentages map to
     * the nearest double of the fraction (e.g. 80 becomes exactly 0.8).
     */
    record PercentToFractionRule() implements ConversionRule {

        @Override
        public Unit from() {
            return Unit.PERCENT;
        }

        @Override
        public Unit to() {
            return Unit.FRACTION;
        }

        @Override
        public String variableId() {
            return null;
        }

        @Override
        public double apply(double value) {
            return value / 100.0;
        }

        @Override
        public String describe() {
            return "percent-0to100 -> fraction-0to1 /100";
        }
    }
}
