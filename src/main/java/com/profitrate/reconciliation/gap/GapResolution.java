package com.profitrate.reconciliation.gap;

import com.profitrate.reconciliation.core.model.VariableSeries;

import java.util.List;
import java.util.Objects;

/**
 * A resolved series and the gap actions recorded while resolving it.
 */
public record GapResolution(VariableSeries series, List<GapAction> actions) {

    public GapResolution {
        Objects.requireNonNull(series, "series is required");
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public long appliedCount() {
        return actions.stream().filter(GapAction::isApplied).count();
    }
}
