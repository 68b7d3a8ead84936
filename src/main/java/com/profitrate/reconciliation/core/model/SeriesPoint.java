package com.profitrate.reconciliation.core.model;

import java.util.Objects;

/**
 * A resolved value in a {@link VariableSeries} together with how it was obtained.
 * The provenance is the source id of the carried observation.
 */
public record SeriesPoint(Observation observation, ResolutionMethod method) {

    public SeriesPoint {
        Objects.requireNonNull(observation, "observation is required");
        Objects.requireNonNull(method, "method is required");
        if (observation.isMissing()) {
            throw new IllegalArgumentException("A series point must carry a value: " + observation);
        }
    }

    public int year() {
        return observation.year();
    }

    public double value() {
        return observation.value();
    }

    public String sourceId() {
        return observation.sourceId();
    }
}
