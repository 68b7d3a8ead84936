package com.profitrate.reconciliation.merge;

import com.profitrate.reconciliation.core.model.VariableSeries;

import java.util.List;
import java.util.Objects;

/**
 * Result of merging the observation sets of one variable.
 *
 * @param series    the merged series
 * @param conflicts every year where sources disagreed, in year order
 */
public record MergeOutcome(VariableSeries series, List<MergeConflict> conflicts) {

    public MergeOutcome {
        Objects.requireNonNull(series, "series is required");
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
