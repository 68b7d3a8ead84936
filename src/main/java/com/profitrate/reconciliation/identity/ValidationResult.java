package com.profitrate.reconciliation.identity;

import com.profitrate.reconciliation.core.model.ResolutionMethod;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Outcome of evaluating one identity in one year.
 *
 * @param identityName   the identity
 * @param year           the year
 * @param expected       value given by the formula
 * @param observed       published value of the observed variable
 * @param absoluteError  {@code |expected - observed|}
 * @param relativeError  {@code absoluteError / |observed|}; NaN when observed is 0
 * @param classification match, within tolerance or flagged
 * @param basis          native, or gap-filled when any value involved was filled
 * @param inputMethods   resolution method of every input and of the observed value
 */
public record ValidationResult(
        String identityName,
        int year,
        double expected,
        double observed,
        double absoluteError,
        double relativeError,
        Classification classification,
        ValidationBasis basis,
        Map<String, ResolutionMethod> inputMethods
) {
    public ValidationResult {
        Objects.requireNonNull(identityName, "identityName is required");
        Objects.requireNonNull(classification, "classification is required");
        Objects.requireNonNull(basis, "basis is required");
        inputMethods = Collections.unmodifiableMap(new TreeMap<>(inputMethods != null ? inputMethods : Map.of()));
    }

    /**
     * {@code expected - observed}.
     */
    public double signedError() {
        return expected - observed;
    }

    public boolean isFlagged() {
        return classification == Classification.FLAGGED;
    }
}
