package com.profitrate.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Series model Tests")
class VariableSeriesTest {

    @Nested
    @DisplayName("Observation")
    class ObservationTests {

        @Test
        @DisplayName("Should reject years outside 1900-2100")
        void rejectsOutOfRangeYear() {
            assertThrows(IllegalArgumentException.class,
                    () -> Observation.of("K", 1899, 1.0, Unit.INDEX, "A"));
            assertThrows(IllegalArgumentException.class,
                    () -> Observation.of("K", 2101, 1.0, Unit.INDEX, "A"));
        }

        @Test
        @DisplayName("Should reject non-finite values")
        void rejectsNonFiniteValue() {
            assertThrows(IllegalArgumentException.class,
                    () -> Observation.of("K", 1960, Double.NaN, Unit.INDEX, "A"));
        }

        @Test
        @DisplayName("Missing observation carries no value")
        void missingHasNoValue() {
            Observation o = Observation.missing("K", 1960, Unit.INDEX, "A");
            assertTrue(o.isMissing());
            assertFalse(o.hasValue());
        }
    }

    @Nested
    @DisplayName("ObservationSet")
    class ObservationSetTests {

        @Test
        @DisplayName("Should sort observations by year")
        void sortsByYear() {
            ObservationSet set = new ObservationSet("K", "A", Unit.INDEX, List.of(
                    Observation.of("K", 1961, 2.0, Unit.INDEX, "A"),
                    Observation.of("K", 1960, 1.0, Unit.INDEX, "A")));

            assertEquals(1960, set.getObservations().get(0).year());
            assertEquals(2.0, set.get(1961).orElseThrow().value());
        }

        @Test
        @DisplayName("Should reject duplicate years and foreign units")
        void rejectsDuplicatesAndForeignUnits() {
            assertThrows(IllegalArgumentException.class, () -> new ObservationSet("K", "A", Unit.INDEX, List.of(
                    Observation.of("K", 1960, 1.0, Unit.INDEX, "A"),
                    Observation.of("K", 1960, 2.0, Unit.INDEX, "A"))));
            assertThrows(IllegalArgumentException.class, () -> new ObservationSet("K", "A", Unit.INDEX, List.of(
                    Observation.of("K", 1960, 1.0, Unit.PERCENT, "A"))));
        }
    }

    @Nested
    @DisplayName("VariableSeries")
    class SeriesTests {

        @Test
        @DisplayName("Adding a point removes the year from missing years")
        void pointClearsMissing() {
            VariableSeries series = VariableSeries.builder("K", Unit.CURRENCY_BILLIONS)
                    .missing(1961)
                    .point(Observation.of("K", 1961, 5.0, Unit.CURRENCY_BILLIONS, "A"), ResolutionMethod.NATIVE)
                    .missing(1961)
                    .build();

            assertTrue(series.getMissingYears().isEmpty());
            assertTrue(series.hasValue(1961));
        }

        @Test
        @DisplayName("Should expose provenance and resolution methods per year")
        void exposesProvenance() {
            VariableSeries series = VariableSeries.builder("K", Unit.CURRENCY_BILLIONS)
                    .point(Observation.of("K", 1960, 1.0, Unit.CURRENCY_BILLIONS, "A"), ResolutionMethod.NATIVE)
                    .point(Observation.of("K", 1961, 2.0, Unit.CURRENCY_BILLIONS, "B"), ResolutionMethod.MERGED)
                    .missing(1962)
                    .build();

            assertEquals(Map.of(1960, "A", 1961, "B"), series.provenance());
            assertEquals(ResolutionMethod.MERGED, series.resolutionMethods().get(1961));
            assertEquals(List.of(1960, 1961, 1962), List.copyOf(series.allYears()));
            assertEquals(1960, series.firstYear().getAsInt());
            assertEquals(1962, series.lastYear().getAsInt());
            assertEquals(1, series.count(ResolutionMethod.NATIVE));
        }

        @Test
        @DisplayName("Should reject points in a different unit")
        void rejectsForeignUnit() {
            VariableSeries.Builder builder = VariableSeries.builder("K", Unit.CURRENCY_BILLIONS);
            assertThrows(IllegalArgumentException.class, () -> builder.point(
                    Observation.of("K", 1960, 1.0, Unit.CURRENCY_MILLIONS, "A"), ResolutionMethod.NATIVE));
        }

        @Test
        @DisplayName("Filled methods are gap-filled and manual override only")
        void filledMethods() {
            assertTrue(ResolutionMethod.GAP_FILLED_LINEAR.isFilled());
            assertTrue(ResolutionMethod.MANUAL_OVERRIDE.isFilled());
            assertFalse(ResolutionMethod.NATIVE.isFilled());
            assertFalse(ResolutionMethod.MERGED.isFilled());
            assertFalse(ResolutionMethod.DERIVED.isFilled());
        }
    }
}
