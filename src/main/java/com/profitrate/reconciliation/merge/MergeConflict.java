package com.profitrate.reconciliation.merge;

import java.util.List;
import java.util.Objects;

/**
 * Two or more sources reported different values for the same variable and year.
 * The chosen value is retained in the series; every rejected alternative is kept here.
 */
public record MergeConflict(
        String variableId,
        int year,
        String chosenSourceId,
        double chosenValue,
        List<RejectedAlternative> alternatives,
        String rationale
) {
    public MergeConflict {
        Objects.requireNonNull(variableId, "variableId is required");
        Objects.requireNonNull(chosenSourceId, "chosenSourceId is required");
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }

    /**
     * Largest absolute disagreement between the chosen value and any alternative.
     */
    public double maxAbsoluteDifference() {
        return alternatives.stream().mapToDouble(RejectedAlternative::absoluteDifference).max().orElse(0.0);
    }

    /**
     * A value from a lower-priority source that was not retained.
     *
     * @param sourceId           source of the rejected value
     * @param value              the rejected value
     * @param absoluteDifference {@code |value - chosen|}
     * @param relativeDifference {@code |value - chosen| / |chosen|}, NaN when the chosen value is 0
     */
    public record RejectedAlternative(String sourceId, double value, double absoluteDifference,
                                      double relativeDifference) {}
}
