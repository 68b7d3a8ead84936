package com.profitrate.reconciliation.identity;

/**
 * Error tolerance of an identity. A result is within tolerance when either bound holds.
 *
 * @param absolute maximum absolute error
 * @param relative maximum relative error (fraction of the observed value)
 */
public record Tolerance(double absolute, double relative) {

    public Tolerance {
        if (absolute < 0 || Double.isNaN(absolute)) {
            throw new IllegalArgumentException("absolute tolerance must be >= 0, got " + absolute);
        }
        if (relative < 0 || Double.isNaN(relative)) {
            throw new IllegalArgumentException("relative tolerance must be >= 0, got " + relative);
        }
    }

    public static Tolerance exact() {
        return new Tolerance(0.0, 0.0);
    }

    public static Tolerance absolute(double absolute) {
        return new Tolerance(absolute, 0.0);
    }
}
