package com.profitrate.reconciliation.core.model;

import java.util.Objects;

/**
 * A single (variable, year, value, unit, source) data point.
 * A {@code null} value means the source reported the year as missing.
 */
public record Observation(
        String variableId,
        int year,
        Double value,
        Unit unit,
        String sourceId
) {
    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2100;

    public Observation {
        Objects.requireNonNull(variableId, "variableId is required");
        Objects.requireNonNull(unit, "unit is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        checkYear(year);
        if (value != null && (value.isNaN() || value.isInfinite())) {
            throw new IllegalArgumentException("value must be finite or missing, got " + value
                    + " for " + variableId + "@" + year);
        }
    }

    public static Observation of(String variableId, int year, double value, Unit unit, String sourceId) {
        return new Observation(variableId, year, value, unit, sourceId);
    }

    public static Observation missing(String variableId, int year, Unit unit, String sourceId) {
        return new Observation(variableId, year, null, unit, sourceId);
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isMissing() {
        return value == null;
    }

    /**
     * Returns a copy carrying a different value and unit; provenance is kept.
     */
    public Observation withValue(Double newValue, Unit newUnit) {
        return new Observation(variableId, year, newValue, newUnit, sourceId);
    }

    static void checkYear(int year) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("year must be within " + MIN_YEAR + "-" + MAX_YEAR + ", got " + year);
        }
    }
}
