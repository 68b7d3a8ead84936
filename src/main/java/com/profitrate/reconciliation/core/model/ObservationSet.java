package com.profitrate.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, year-ordered observations of one variable from one source.
 */
public final class ObservationSet {
    private final String variableId;
    private final String sourceId;
    private final Unit unit;
    private final List<Observation> observations;
    private final String contentDigest;

    public ObservationSet(String variableId, String sourceId, Unit unit, List<Observation> observations) {
        this(variableId, sourceId, unit, observations, null);
    }

    /**
     * @param contentDigest SHA-256 of the bytes the set was read from, or null when it was
     *                      not read from a file
     */
    public ObservationSet(String variableId, String sourceId, Unit unit, List<Observation> observations,
                          String contentDigest) {
        this.variableId = Objects.requireNonNull(variableId, "variableId is required");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId is required");
        this.unit = Objects.requireNonNull(unit, "unit is required");

        List<Observation> sorted = new ArrayList<>(observations != null ? observations : List.of());
        sorted.sort(Comparator.comparingInt(Observation::year));
        Set<Integer> seen = new HashSet<>();
        for (Observation o : sorted) {
            if (!o.variableId().equals(variableId) || !o.sourceId().equals(sourceId)) {
                throw new IllegalArgumentException("Observation " + o + " does not belong to set "
                        + variableId + "/" + sourceId);
            }
            if (o.unit() != unit) {
                throw new IllegalArgumentException("Observation unit " + o.unit() + " differs from set unit " + unit);
            }
            if (!seen.add(o.year())) {
                throw new IllegalArgumentException("Duplicate year " + o.year() + " in set " + variableId + "/" + sourceId);
            }
        }
        this.observations = List.copyOf(sorted);
        this.contentDigest = contentDigest;
    }

    public String getVariableId() {
        return variableId;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Unit getUnit() {
        return unit;
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public Optional<String> getContentDigest() {
        return Optional.ofNullable(contentDigest);
    }

    public Optional<Observation> get(int year) {
        return observations.stream().filter(o -> o.year() == year).findFirst();
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /**
     * Number of observations that carry a value.
     */
    public long valueCount() {
        return observations.stream().filter(Observation::hasValue).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObservationSet that)) return false;
        return variableId.equals(that.variableId) && sourceId.equals(that.sourceId)
                && unit == that.unit && observations.equals(that.observations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variableId, sourceId, unit, observations);
    }

    @Override
    public String toString() {
        return "ObservationSet{variable=" + variableId + ", source=" + sourceId
                + ", unit=" + unit + ", size=" + observations.size() + '}';
    }
}
