package com.profitrate.reconciliation.identity;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.List;

/**
 * Descriptive checks telling random measurement noise apart from patterned error.
 * Each statistic is null when there are too few points for it.
 *
 * @param identityName          the identity
 * @param count                 number of results examined
 * @param runsZScore            Wald-Wolfowitz runs test about the median error
 * @param errorsRandom          {@code |runsZScore| < 1.96}
 * @param lag1Autocorrelation   correlation of each error with the previous year's
 * @param errorsIndependent     {@code |lag1Autocorrelation| < 0.3}
 * @param magnitudeCorrelation  correlation of the observed value with the absolute error
 * @param magnitudeDependent    {@code |magnitudeCorrelation| > 0.5}
 * @param trendSlopePerYear     least-squares slope of the signed error against the year
 */
public record ErrorDiagnostics(
        String identityName,
        int count,
        Double runsZScore,
        Boolean errorsRandom,
        Double lag1Autocorrelation,
        Boolean errorsIndependent,
        Double magnitudeCorrelation,
        Boolean magnitudeDependent,
        Double trendSlopePerYear
) {
    static final int MIN_RUNS_TEST = 6;
    static final int MIN_AUTOCORRELATION = 4;
    static final int MIN_MAGNITUDE = 6;
    static final int MIN_TREND = 3;

    /**
     * Computes diagnostics over results sorted by year.
     */
    static ErrorDiagnostics of(String identityName, List<ValidationResult> results) {
        int n = results.size();
        double[] years = new double[n];
        double[] errors = new double[n];
        double[] observed = new double[n];
        double[] absErrors = new double[n];
        for (int i = 0; i < n; i++) {
            ValidationResult r = results.get(i);
            years[i] = r.year();
            errors[i] = r.signedError();
            observed[i] = r.observed();
            absErrors[i] = r.absoluteError();
        }

        Double runsZ = n >= MIN_RUNS_TEST ? runsTestZ(errors) : null;
        Double autocorr = null;
        if (n >= MIN_AUTOCORRELATION) {
            double[] head = new double[n - 1];
            double[] tail = new double[n - 1];
            System.arraycopy(errors, 0, head, 0, n - 1);
            System.arraycopy(errors, 1, tail, 0, n - 1);
            autocorr = pearson(head, tail);
        }
        Double magnitude = n >= MIN_MAGNITUDE ? pearson(observed, absErrors) : null;
        Double slope = n >= MIN_TREND ? slope(years, errors) : null;

        return new ErrorDiagnostics(identityName, n,
                runsZ, runsZ == null ? null : Math.abs(runsZ) < 1.96,
                autocorr, autocorr == null ? null : Math.abs(autocorr) < 0.3,
                magnitude, magnitude == null ? null : Math.abs(magnitude) > 0.5,
                slope);
    }

    static Double runsTestZ(double[] errors) {
        double median = median(errors);
        int above = 0;
        int below = 0;
        int runs = 1;
        for (int i = 0; i < errors.length; i++) {
            boolean isAbove = errors[i] > median;
            if (isAbove) {
                above++;
            } else {
                below++;
            }
            if (i > 0 && isAbove != errors[i - 1] > median) {
                runs++;
            }
        }
        double n1 = above;
        double n2 = below;
        double total = n1 + n2;
        double expected = (2 * n1 * n2) / total + 1;
        double variance = (2 * n1 * n2 * (2 * n1 * n2 - n1 - n2)) / (total * total * (total - 1));
        if (variance <= 0) {
            return 0.0;
        }
        return (runs - expected) / Math.sqrt(variance);
    }

    static double median(double[] values) {
        return new Median().evaluate(values);
    }

    /**
     * Pearson correlation, or null when either side has no variance.
     */
    static Double pearson(double[] x, double[] y) {
        if (StatUtils.variance(x) == 0 || StatUtils.variance(y) == 0) {
            return null;
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        return Double.isNaN(r) ? null : r;
    }

    static Double slope(double[] x, double[] y) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < x.length; i++) {
            regression.addData(x[i], y[i]);
        }
        double slope = regression.getSlope();
        return Double.isNaN(slope) ? null : slope;
    }
}
