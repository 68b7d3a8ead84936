package com.profitrate.reconciliation.report;

import java.util.Objects;

/**
 * A per-variable failure that was downgraded to a report entry instead of aborting the run.
 *
 * @param variableId the variable whose chain failed
 * @param sourceId   the failing source, or null when the failure concerns the whole variable
 * @param stage      stage that failed (load, normalize, merge, gap-resolve, chain)
 * @param errorType  simple class name of the error
 * @param message    error message
 */
public record FailedSource(String variableId, String sourceId, String stage, String errorType, String message) {

    public FailedSource {
        Objects.requireNonNull(variableId, "variableId is required");
        Objects.requireNonNull(stage, "stage is required");
    }

    public static FailedSource of(String variableId, String sourceId, String stage, Throwable error) {
        return new FailedSource(variableId, sourceId, stage, error.getClass().getSimpleName(), error.getMessage());
    }
}
