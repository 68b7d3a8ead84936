package com.profitrate.reconciliation.identity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the validator learned about one identity.
 *
 * @param rule          the identity
 * @param results       per-year results, in year order
 * @param skips         years that could not be evaluated, in year order
 * @param biasFinding   systematic bias, or null when none was found
 * @param statistics    error statistics, one entry per basis present
 * @param diagnostics   descriptive randomness diagnostics, or null without results
 */
public record IdentityValidation(
        IdentityRule rule,
        List<ValidationResult> results,
        List<IdentitySkip> skips,
        SystematicBiasFinding biasFinding,
        List<ErrorStatistics> statistics,
        ErrorDiagnostics diagnostics
) {
    public IdentityValidation {
        Objects.requireNonNull(rule, "rule is required");
        results = results != null ? List.copyOf(results) : List.of();
        skips = skips != null ? List.copyOf(skips) : List.of();
        statistics = statistics != null ? List.copyOf(statistics) : List.of();
    }

    public Optional<SystematicBiasFinding> bias() {
        return Optional.ofNullable(biasFinding);
    }

    public Optional<ValidationResult> resultFor(int year) {
        return results.stream().filter(r -> r.year() == year).findFirst();
    }

    public long flaggedCount() {
        return results.stream().filter(ValidationResult::isFlagged).count();
    }
}
