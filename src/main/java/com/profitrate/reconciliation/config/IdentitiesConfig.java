package com.profitrate.reconciliation.config;

import java.util.List;

/**
 * JSON binding of the identities document.
 *
 * <pre>
 * {
 *   "identities": [
 *     {"name": "profit-rate", "formula": "SP / (K * u)", "observed": "r",
 *      "tolerance": {"absolute": 0.001, "relative": 0.0}}
 *   ],
 *   "derived": [
 *     {"variableId": "e", "formula": "S / V", "unit": "index"}
 *   ]
 * }
 * </pre>
 */
public record IdentitiesConfig(List<IdentityEntry> identities, List<DerivedEntry> derived) {

    public record IdentityEntry(String name, String formula, String observed, ToleranceEntry tolerance) {}

    public record ToleranceEntry(Double absolute, Double relative) {}

    public record DerivedEntry(String variableId, String formula, String unit) {}
}
