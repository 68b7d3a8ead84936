package com.profitrate.reconciliation.pipeline;

import com.profitrate.reconciliation.core.model.VariableSeries;
import com.profitrate.reconciliation.gap.GapAction;
import com.profitrate.reconciliation.merge.MergeConflict;
import com.profitrate.reconciliation.report.FailedSource;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Result of one variable chain (load, normalize, merge, gap-resolve).
 * A failed chain carries no series; its failures still reach the report.
 */
public record VariableChainResult(
        boolean success,
        String variableId,
        VariableSeries series,
        List<MergeConflict> conflicts,
        List<GapAction> gapActions,
        List<FailedSource> failures,
        Map<String, String> digests
) {
    public VariableChainResult {
        Objects.requireNonNull(variableId, "variableId is required");
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        gapActions = gapActions != null ? List.copyOf(gapActions) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        digests = Collections.unmodifiableMap(new TreeMap<>(digests != null ? digests : Map.of()));
    }

    /**
     * Creates a completed chain result. Failures of individual sources may still be present.
     */
    public static VariableChainResult success(VariableSeries series, List<MergeConflict> conflicts,
                                              List<GapAction> gapActions, List<FailedSource> failures,
                                              Map<String, String> digests) {
        return new VariableChainResult(true, series.getVariableId(), series, conflicts, gapActions,
                failures, digests);
    }

    /**
     * Creates a failed chain result: the variable gets no series.
     */
    public static VariableChainResult failure(String variableId, List<FailedSource> failures,
                                              Map<String, String> digests) {
        return new VariableChainResult(false, variableId, null, List.of(), List.of(), failures, digests);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
