package com.profitrate.reconciliation.identity;

import java.util.Objects;

/**
 * A consistently signed error across most years of one identity. Points to a wrong
 * formula or an undocumented scaling rather than random noise.
 *
 * @param identityName    the identity
 * @param sign            direction of the bias
 * @param meanSignedError mean of {@code expected - observed}
 * @param signShare       share of years whose error has the bias sign
 * @param yearCount       number of evaluated years
 * @param firstYear       first evaluated year
 * @param lastYear        last evaluated year
 */
public record SystematicBiasFinding(
        String identityName,
        Sign sign,
        double meanSignedError,
        double signShare,
        int yearCount,
        int firstYear,
        int lastYear
) {
    public SystematicBiasFinding {
        Objects.requireNonNull(identityName, "identityName is required");
        Objects.requireNonNull(sign, "sign is required");
    }

    public enum Sign {
        POSITIVE("positive"),
        NEGATIVE("negative");

        private final String label;

        Sign(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
