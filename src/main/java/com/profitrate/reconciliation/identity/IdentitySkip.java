package com.profitrate.reconciliation.identity;

import java.util.List;
import java.util.Objects;

/**
 * A year where an identity could not be evaluated. Recorded, never thrown.
 *
 * @param identityName     the identity
 * @param year             the year
 * @param reason           why the year was skipped
 * @param missingVariables variables without a value in that year
 */
public record IdentitySkip(String identityName, int year, Reason reason, List<String> missingVariables) {

    public IdentitySkip {
        Objects.requireNonNull(identityName, "identityName is required");
        Objects.requireNonNull(reason, "reason is required");
        missingVariables = missingVariables != null ? List.copyOf(missingVariables) : List.of();
    }

    public enum Reason {
        INPUT_MISSING("input-missing"),
        OBSERVED_MISSING("observed-missing"),
        FORMULA_UNDEFINED("formula-undefined");

        private final String label;

        Reason(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
