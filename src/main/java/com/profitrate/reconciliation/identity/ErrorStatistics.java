package com.profitrate.reconciliation.identity;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;

/**
 * Summary of the errors of one identity over results sharing a basis.
 * Native and gap-filled results are always summarized separately.
 */
public record ErrorStatistics(
        String identityName,
        ValidationBasis basis,
        int count,
        double meanSignedError,
        double meanAbsoluteError,
        double maxAbsoluteError,
        long flaggedCount
) {

    /**
     * Summarizes the given results, or returns null when there are none.
     */
    static ErrorStatistics of(String identityName, ValidationBasis basis, List<ValidationResult> results) {
        if (results.isEmpty()) {
            return null;
        }
        DescriptiveStatistics signed = new DescriptiveStatistics();
        DescriptiveStatistics absolute = new DescriptiveStatistics();
        long flagged = 0;
        for (ValidationResult r : results) {
            signed.addValue(r.signedError());
            absolute.addValue(r.absoluteError());
            if (r.isFlagged()) {
                flagged++;
            }
        }
        return new ErrorStatistics(identityName, basis, results.size(), signed.getMean(), absolute.getMean(),
                absolute.getMax(), flagged);
    }
}
