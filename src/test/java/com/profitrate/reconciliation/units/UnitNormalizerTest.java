package com.profitrate.reconciliation.units;

import com.profitrate.reconciliation.core.model.Observation;
import com.profitrate.reconciliation.core.model.ObservationSet;
import com.profitrate.reconciliation.core.model.Unit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UnitNormalizer Tests")
class UnitNormalizerTest {

    private final UnitNormalizer normalizer = new UnitNormalizer();

    private static ObservationSet set(String variableId, Unit unit, Double... values) {
        List<Observation> observations = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            observations.add(new Observation(variableId, 1960 + i, values[i], unit, "A"));
        }
        return new ObservationSet(variableId, "A", unit, observations);
    }

    @Nested
    @DisplayName("Default rules")
    class DefaultRules {

        @Test
        @DisplayName("Should convert millions to billions and keep missing values missing")
        void millionsToBillions() {
            ObservationSet result = normalizer.normalize(
                    set("K", Unit.CURRENCY_MILLIONS, 1500.0, null, 250.0), Unit.CURRENCY_BILLIONS);

            assertEquals(Unit.CURRENCY_BILLIONS, result.getUnit());
            assertEquals(1.5, result.get(1960).orElseThrow().value(), 1e-12);
            assertTrue(result.get(1961).orElseThrow().isMissing());
            assertEquals(0.25, result.get(1962).orElseThrow().value(), 1e-12);
            assertEquals("A", result.get(1962).orElseThrow().sourceId());
        }

        @Test
        @DisplayName("Should convert percent to fraction exactly")
        void percentToFraction() {
            ObservationSet result = normalizer.normalize(set("u", Unit.PERCENT, 80.0), Unit.FRACTION);

            assertEquals(0.8, result.get(1960).orElseThrow().value());
        }

        @Test
        @DisplayName("Same unit without a rule is a no-op")
        void sameUnitNoOp() {
            ObservationSet input = set("K", Unit.CURRENCY_BILLIONS, 1.0);

            assertSame(input, normalizer.normalize(input, Unit.CURRENCY_BILLIONS));
        }
    }

    @Nested
    @DisplayName("No silent scaling")
    class NoSilentScaling {

        @Test
        @DisplayName("Should refuse an undeclared pair")
        void undeclaredPair() {
            UnsupportedConversionException e = assertThrows(UnsupportedConversionException.class,
                    () -> normalizer.normalize(set("K", Unit.CURRENCY_MILLIONS, 1.0), Unit.PERCENT));

            assertEquals(Unit.CURRENCY_MILLIONS, e.getFrom());
            assertEquals(Unit.PERCENT, e.getTo());
        }

        @Test
        @DisplayName("An empty table converts nothing")
        void emptyTable() {
            UnitNormalizer strict = new UnitNormalizer(UnitConversionTable.empty());

            assertThrows(UnsupportedConversionException.class,
                    () -> strict.normalize(set("K", Unit.CURRENCY_MILLIONS, 1000.0), Unit.CURRENCY_BILLIONS));
            assertFalse(strict.canNormalize(Unit.CURRENCY_MILLIONS, Unit.CURRENCY_BILLIONS, "K"));
            assertTrue(strict.canNormalize(Unit.INDEX, Unit.INDEX, "K"));
        }
    }

    @Nested
    @DisplayName("Declared rules")
    class DeclaredRules {

        @Test
        @DisplayName("Should rebase an index with its declared base value")
        void rebaseIndex() {
            UnitConversionTable table = UnitConversionTable.builder()
                    .rule(new RebaseRule(Unit.INDEX, Unit.INDEX, 2000, 80.0, 100.0, "P"))
                    .build();
            UnitNormalizer rebasing = new UnitNormalizer(table);

            ObservationSet result = rebasing.normalize(set("P", Unit.INDEX, 40.0, 80.0), Unit.INDEX);

            assertEquals(50.0, result.get(1960).orElseThrow().value(), 1e-12);
            assertEquals(100.0, result.get(1961).orElseThrow().value(), 1e-12);
        }

        @Test
        @DisplayName("A variable-scoped rule wins over a general rule")
        void scopedRuleWins() {
            UnitConversionTable table = UnitConversionTable.builder()
                    .multiplier(Unit.CURRENCY_MILLIONS, Unit.CURRENCY_BILLIONS, 0.001)
                    .rule(new MultiplierRule(Unit.CURRENCY_MILLIONS, Unit.CURRENCY_BILLIONS, 0.002, "K"))
                    .build();
            UnitNormalizer scoped = new UnitNormalizer(table);

            assertEquals(2.0, scoped.normalize(set("K", Unit.CURRENCY_MILLIONS, 1000.0), Unit.CURRENCY_BILLIONS)
                    .get(1960).orElseThrow().value(), 1e-12);
            assertEquals(1.0, scoped.normalize(set("SP", Unit.CURRENCY_MILLIONS, 1000.0), Unit.CURRENCY_BILLIONS)
                    .get(1960).orElseThrow().value(), 1e-12);
        }

        @Test
        @DisplayName("A scoped rebase does not apply to other variables")
        void scopedRebaseOnly() {
            UnitConversionTable table = UnitConversionTable.builder()
                    .rule(new RebaseRule(Unit.INDEX, Unit.INDEX, 2000, 80.0, 100.0, "P"))
                    .build();
            ObservationSet other = set("Q", Unit.INDEX, 40.0);

            assertSame(other, new UnitNormalizer(table).normalize(other, Unit.INDEX));
        }

        @Test
        @DisplayName("Rules reject invalid factors and base values")
        void invalidRules() {
            assertThrows(IllegalArgumentException.class,
                    () -> new MultiplierRule(Unit.CURRENCY_MILLIONS, Unit.CURRENCY_BILLIONS, 0.0));
            assertThrows(IllegalArgumentException.class,
                    () -> new RebaseRule(Unit.INDEX, Unit.INDEX, 2000, 0.0, 100.0, null));
        }
    }

    @Test
    @DisplayName("Default table declares currency and ratio rules only")
    void defaultTableContents() {
        UnitConversionTable table = DefaultConversionRules.createDefaultTable();

        assertEquals(4, table.size());
        assertTrue(table.supports(Unit.CURRENCY_BILLIONS, Unit.CURRENCY_MILLIONS, "K"));
        assertTrue(table.supports(Unit.FRACTION, Unit.PERCENT, null));
        assertFalse(table.supports(Unit.INDEX, Unit.INDEX, "P"));
    }
}
