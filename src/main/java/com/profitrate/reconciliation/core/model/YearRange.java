package com.profitrate.reconciliation.core.model;

/**
 * Inclusive range of years.
 *
 * @param from first year (inclusive)
 * @param to   last year (inclusive)
 */
public record YearRange(int from, int to) {

    public YearRange {
        if (from > to) {
            throw new IllegalArgumentException("from must be <= to: " + from + " > " + to);
        }
        Observation.checkYear(from);
        Observation.checkYear(to);
    }

    public static YearRange of(int from, int to) {
        return new YearRange(from, to);
    }

    /**
     * The whole supported historical range.
     */
    public static YearRange unbounded() {
        return new YearRange(Observation.MIN_YEAR, Observation.MAX_YEAR);
    }

    public boolean contains(int year) {
        return year >= from && year <= to;
    }

    public int length() {
        return to - from + 1;
    }

    @Override
    public String toString() {
        return from + "-" + to;
    }
}
