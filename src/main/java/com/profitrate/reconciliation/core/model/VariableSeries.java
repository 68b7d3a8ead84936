package com.profitrate.reconciliation.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The resolved, year-indexed view of one variable.
 *
 * <p>Instances are immutable. The series merger builds the initial series and the gap
 * resolver derives filled copies through {@link #toBuilder()}; no other component
 * changes a series.</p>
 *
 * <p>Years that some source mentioned but none reported a value for are kept in
 * {@link #getMissingYears()} so they never silently disappear.</p>
 */
public final class VariableSeries {
    private final String variableId;
    private final Unit unit;
    private final NavigableMap<Integer, SeriesPoint> points;
    private final SortedSet<Integer> missingYears;

    private VariableSeries(Builder builder) {
        this.variableId = builder.variableId;
        this.unit = builder.unit;
        this.points = Collections.unmodifiableNavigableMap(new TreeMap<>(builder.points));
        TreeSet<Integer> missing = new TreeSet<>(builder.missingYears);
        missing.removeAll(builder.points.keySet());
        this.missingYears = Collections.unmodifiableSortedSet(missing);
    }

    public String getVariableId() {
        return variableId;
    }

    public Unit getUnit() {
        return unit;
    }

    public NavigableMap<Integer, SeriesPoint> getPoints() {
        return points;
    }

    public SortedSet<Integer> getMissingYears() {
        return missingYears;
    }

    public Optional<SeriesPoint> get(int year) {
        return Optional.ofNullable(points.get(year));
    }

    public boolean hasValue(int year) {
        return points.containsKey(year);
    }

    /**
     * Year → source id of the retained value.
     */
    public Map<Integer, String> provenance() {
        Map<Integer, String> result = new LinkedHashMap<>();
        points.forEach((year, point) -> result.put(year, point.sourceId()));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Year → how the retained value was obtained.
     */
    public Map<Integer, ResolutionMethod> resolutionMethods() {
        Map<Integer, ResolutionMethod> result = new LinkedHashMap<>();
        points.forEach((year, point) -> result.put(year, point.method()));
        return Collections.unmodifiableMap(result);
    }

    /**
     * All years known to the series, with or without a value.
     */
    public SortedSet<Integer> allYears() {
        TreeSet<Integer> years = new TreeSet<>(points.keySet());
        years.addAll(missingYears);
        return Collections.unmodifiableSortedSet(years);
    }

    public OptionalInt firstYear() {
        SortedSet<Integer> years = allYears();
        return years.isEmpty() ? OptionalInt.empty() : OptionalInt.of(years.first());
    }

    public OptionalInt lastYear() {
        SortedSet<Integer> years = allYears();
        return years.isEmpty() ? OptionalInt.empty() : OptionalInt.of(years.last());
    }

    public int size() {
        return points.size();
    }

    public long count(ResolutionMethod method) {
        return points.values().stream().filter(p -> p.method() == method).count();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(variableId, unit);
        builder.points.putAll(points);
        builder.missingYears.addAll(missingYears);
        return builder;
    }

    public static Builder builder(String variableId, Unit unit) {
        return new Builder(variableId, unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableSeries that)) return false;
        return variableId.equals(that.variableId) && unit == that.unit
                && points.equals(that.points) && missingYears.equals(that.missingYears);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variableId, unit, points, missingYears);
    }

    @Override
    public String toString() {
        return "VariableSeries{variable=" + variableId + ", unit=" + unit
                + ", points=" + points.size() + ", missing=" + missingYears.size() + '}';
    }

    public static class Builder {
        private final String variableId;
        private final Unit unit;
        private final TreeMap<Integer, SeriesPoint> points = new TreeMap<>();
        private final TreeSet<Integer> missingYears = new TreeSet<>();

        private Builder(String variableId, Unit unit) {
            this.variableId = Objects.requireNonNull(variableId, "variableId is required");
            this.unit = Objects.requireNonNull(unit, "unit is required");
        }

        public Builder point(Observation observation, ResolutionMethod method) {
            return point(new SeriesPoint(observation, method));
        }

        public Builder point(SeriesPoint point) {
            Observation o = point.observation();
            if (!o.variableId().equals(variableId)) {
                throw new IllegalArgumentException("Point for " + o.variableId() + " added to series " + variableId);
            }
            if (o.unit() != unit) {
                throw new IllegalArgumentException("Point unit " + o.unit() + " differs from series unit " + unit);
            }
            points.put(point.year(), point);
            missingYears.remove(point.year());
            return this;
        }

        public Builder missing(int year) {
            Observation.checkYear(year);
            if (!points.containsKey(year)) {
                missingYears.add(year);
            }
            return this;
        }

        public VariableSeries build() {
            return new VariableSeries(this);
        }
    }
}
