package com.profitrate.reconciliation.gap;

/**
 * The named strategies for handling missing years. No other filling strategy exists.
 */
public sealed interface GapPolicy
        permits GapPolicy.LeaveMissing, GapPolicy.BoundedLinearInterpolation, GapPolicy.ManualOverride {

    /**
     * Configuration name of the policy.
     */
    String name();

    static GapPolicy leaveMissing() {
        return LeaveMissing.INSTANCE;
    }

    static GapPolicy boundedLinear(int maxGapYears) {
        return new BoundedLinearInterpolation(maxGapYears);
    }

    static GapPolicy manualOverride(int year, double value, String rationale) {
        return new ManualOverride(year, value, rationale);
    }

    /**
     * Leaves the series unchanged. The default.
     */
    record LeaveMissing() implements GapPolicy {
        static final LeaveMissing INSTANCE = new LeaveMissing();

        @Override
        public String name() {
            return "leave-missing";
        }
    }

    /**
     * Fills runs of at most {@code maxGapYears} missing years lying between two present years.
     */
    record BoundedLinearInterpolation(int maxGapYears) implements GapPolicy {
        public BoundedLinearInterpolation {
            if (maxGapYears < 1) {
                throw new IllegalArgumentException("maxGapYears must be >= 1, got " + maxGapYears);
            }
        }

        @Override
        public String name() {
            return "bounded-linear-interpolation";
        }
    }

    /**
     * One explicit substitution. The rationale is checked when the override is applied.
     */
    record ManualOverride(int year, double value, String rationale) implements GapPolicy {
        public ManualOverride {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("override value must be finite, got " + value);
            }
        }

        @Override
        public String name() {
            return "manual-override";
        }

        public boolean hasRationale() {
            return rationale != null && !rationale.isBlank();
        }
    }
}
