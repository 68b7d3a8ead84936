package com.profitrate.reconciliation.identity;

import com.profitrate.reconciliation.core.model.ResolutionMethod;
import com.profitrate.reconciliation.core.model.SeriesPoint;
import com.profitrate.reconciliation.core.model.VariableSeries;
import com.profitrate.reconciliation.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Checks a declared identity against resolved series, year by year.
 *
 * <p>Years where an input or the observed value is absent are recorded as
 * {@link IdentitySkip}s. After the per-year pass the validator looks for a systematic
 * bias: a non-zero mean signed error whose sign is shared by more than
 * {@value #BIAS_SIGN_SHARE} of the years.</p>
 */
public class IdentityValidator {
    private static final Logger log = LoggerFactory.getLogger(IdentityValidator.class);

    public static final double BIAS_SIGN_SHARE = 0.8;
    public static final int MIN_BIAS_YEARS = 2;

    /**
     * Validates an identity.
     *
     * @param rule              the identity
     * @param seriesByVariable  resolved series; absent variables are treated as having no values
     * @return results, skips, bias finding and statistics
     */
    public IdentityValidation validate(IdentityRule rule, Map<String, VariableSeries> seriesByVariable) {
        Objects.requireNonNull(rule, "rule is required");
        Objects.requireNonNull(seriesByVariable, "seriesByVariable is required");

        try (LogContext ignored = LogContext.forIdentity(rule.getName())) {
            List<String> inputs = rule.getInputs();
            VariableSeries observedSeries = seriesByVariable.get(rule.getObservedVariable());

            SortedSet<Integer> years = new TreeSet<>();
            for (String input : inputs) {
                VariableSeries s = seriesByVariable.get(input);
                if (s != null) {
                    years.addAll(s.allYears());
                }
            }
            if (observedSeries != null) {
                years.addAll(observedSeries.allYears());
            }

            List<ValidationResult> results = new ArrayList<>();
            List<IdentitySkip> skips = new ArrayList<>();

            for (int year : years) {
                Map<String, Double> values = new HashMap<>();
                Map<String, ResolutionMethod> methods = new TreeMap<>();
                List<String> missing = new ArrayList<>();
                for (String input : inputs) {
                    SeriesPoint point = pointAt(seriesByVariable.get(input), year);
                    if (point == null) {
                        missing.add(input);
                    } else {
                        values.put(input, point.value());
                        methods.put(input, point.method());
                    }
                }
                if (!missing.isEmpty()) {
                    skips.add(new IdentitySkip(rule.getName(), year, IdentitySkip.Reason.INPUT_MISSING, missing));
                    continue;
                }

                SeriesPoint observedPoint = pointAt(observedSeries, year);
                if (observedPoint == null) {
                    skips.add(new IdentitySkip(rule.getName(), year, IdentitySkip.Reason.OBSERVED_MISSING,
                            List.of(rule.getObservedVariable())));
                    continue;
                }
                methods.put(rule.getObservedVariable(), observedPoint.method());

                double expected = rule.getFormula().evaluate(values);
                if (Double.isNaN(expected) || Double.isInfinite(expected)) {
                    skips.add(new IdentitySkip(rule.getName(), year, IdentitySkip.Reason.FORMULA_UNDEFINED, List.of()));
                    continue;
                }

                results.add(compare(rule, year, expected, observedPoint.value(), methods));
            }

            SystematicBiasFinding bias = detectBias(rule.getName(), results);
            List<ErrorStatistics> statistics = new ArrayList<>();
            for (ValidationBasis basis : ValidationBasis.values()) {
                ErrorStatistics stats = ErrorStatistics.of(rule.getName(), basis,
                        results.stream().filter(r -> r.basis() == basis).toList());
                if (stats != null) {
                    statistics.add(stats);
                }
            }
            ErrorDiagnostics diagnostics = results.isEmpty() ? null : ErrorDiagnostics.of(rule.getName(), results);

            long flagged = results.stream().filter(ValidationResult::isFlagged).count();
            log.info("identity.validated identity={} results={} flagged={} skipped={} bias={}",
                    rule.getName(), results.size(), flagged, skips.size(),
                    bias == null ? "none" : bias.sign().label());
            return new IdentityValidation(rule, results, skips, bias, statistics, diagnostics);
        }
    }

    /**
     * Compares expected with observed and classifies the error.
     */
    ValidationResult compare(IdentityRule rule, int year, double expected, double observed,
                             Map<String, ResolutionMethod> methods) {
        double absoluteError = Math.abs(expected - observed);
        double relativeError = observed == 0.0 ? Double.NaN : absoluteError / Math.abs(observed);
        Classification classification = Classification.of(absoluteError, relativeError, rule.getTolerance());
        boolean filled = methods.values().stream().anyMatch(ResolutionMethod::isFilled);
        ValidationBasis basis = filled ? ValidationBasis.GAP_FILLED : ValidationBasis.NATIVE;
        if (classification == Classification.FLAGGED) {
            log.debug("identity.flagged identity={} year={} expected={} observed={} absError={}",
                    rule.getName(), year, expected, observed, absoluteError);
        }
        return new ValidationResult(rule.getName(), year, expected, observed, absoluteError, relativeError,
                classification, basis, methods);
    }

    /**
     * Finds a consistently signed error, or returns null.
     */
    SystematicBiasFinding detectBias(String identityName, List<ValidationResult> results) {
        if (results.size() < MIN_BIAS_YEARS) {
            return null;
        }
        double sum = 0;
        for (ValidationResult r : results) {
            sum += r.signedError();
        }
        double mean = sum / results.size();
        if (mean == 0.0) {
            return null;
        }
        SystematicBiasFinding.Sign sign = mean > 0 ? SystematicBiasFinding.Sign.POSITIVE
                : SystematicBiasFinding.Sign.NEGATIVE;
        long sameSign = results.stream()
                .filter(r -> mean > 0 ? r.signedError() > 0 : r.signedError() < 0)
                .count();
        double share = (double) sameSign / results.size();
        if (share <= BIAS_SIGN_SHARE) {
            return null;
        }
        SystematicBiasFinding finding = new SystematicBiasFinding(identityName, sign, mean, share, results.size(),
                results.get(0).year(), results.get(results.size() - 1).year());
        log.warn("identity.systematicBias identity={} sign={} meanSignedError={} share={}",
                identityName, sign.label(), mean, share);
        return finding;
    }

    private static SeriesPoint pointAt(VariableSeries series, int year) {
        return series == null ? null : series.get(year).orElse(null);
    }
}
