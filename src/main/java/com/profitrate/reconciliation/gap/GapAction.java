package com.profitrate.reconciliation.gap;

import java.util.Objects;

/**
 * Audit record of one gap-resolution decision for a (variable, year).
 *
 * @param variableId    the series concerned
 * @param year          the year concerned
 * @param policy        name of the policy that produced the action
 * @param status        whether a value was written, deliberately not written, or the action failed
 * @param value         the written value, null unless applied
 * @param previousValue the value replaced by an override, null if the year was missing
 * @param lowerAnchor   interpolation anchor year below, null for other policies
 * @param upperAnchor   interpolation anchor year above, null for other policies
 * @param rationale     why the action was taken or refused
 */
public record GapAction(
        String variableId,
        int year,
        String policy,
        Status status,
        Double value,
        Double previousValue,
        Integer lowerAnchor,
        Integer upperAnchor,
        String rationale
) {
    public GapAction {
        Objects.requireNonNull(variableId, "variableId is required");
        Objects.requireNonNull(policy, "policy is required");
        Objects.requireNonNull(status, "status is required");
    }

    public enum Status {
        APPLIED,
        SKIPPED,
        FAILED
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    static GapAction interpolated(String variableId, int year, double value, int lower, int upper, String rationale) {
        return new GapAction(variableId, year, "bounded-linear-interpolation", Status.APPLIED, value, null,
                lower, upper, rationale);
    }

    static GapAction skipped(String variableId, int year, Integer lower, Integer upper, String rationale) {
        return new GapAction(variableId, year, "bounded-linear-interpolation", Status.SKIPPED, null, null,
                lower, upper, rationale);
    }

    static GapAction overridden(String variableId, int year, double value, Double previous, String rationale) {
        return new GapAction(variableId, year, "manual-override", Status.APPLIED, value, previous,
                null, null, rationale);
    }

    static GapAction failed(String variableId, int year, String policy, String rationale) {
        return new GapAction(variableId, year, policy, Status.FAILED, null, null, null, null, rationale);
    }
}
