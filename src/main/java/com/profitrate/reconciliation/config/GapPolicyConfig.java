package com.profitrate.reconciliation.config;

import java.util.List;
import java.util.Map;

/**
 * JSON binding of the gap-policy document. Variables without an entry leave gaps missing.
 *
 * <pre>
 * {
 *   "policies": {
 *     "K": [
 *       {"type": "bounded-linear-interpolation", "maxGapYears": 2},
 *       {"type": "manual-override", "year": 1962, "value": 41.0, "rationale": "benchmark revision"}
 *     ]
 *   },
 *   "bounds": {"K": {"from": 1958, "to": 1989}}
 * }
 * </pre>
 */
public record GapPolicyConfig(
        Map<String, List<PolicyEntry>> policies,
        Map<String, BoundsEntry> bounds
) {

    public record PolicyEntry(String type, Integer maxGapYears, Integer year, Double value, String rationale) {}

    public record BoundsEntry(Integer from, Integer to) {}
}
