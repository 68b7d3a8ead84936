package com.profitrate.reconciliation.config;

import java.util.List;
import java.util.Map;

/**
 * JSON binding of the units document.
 *
 * <pre>
 * {
 *   "nativeUnits": [{"sourceId": "A", "variableId": "K", "unit": "currency-millions"}],
 *   "canonicalUnits": {"K": "currency-billions"},
 *   "includeDefaults": true,
 *   "conversions": [
 *     {"type": "rebase", "from": "index", "to": "index", "variableId": "P",
 *      "baseYear": 2000, "baseValue": 80.0, "scale": 100.0}
 *   ]
 * }
 * </pre>
 */
public record UnitsConfig(
        List<NativeUnitEntry> nativeUnits,
        Map<String, String> canonicalUnits,
        Boolean includeDefaults,
        List<ConversionEntry> conversions
) {

    public record NativeUnitEntry(String sourceId, String variableId, String unit) {}

    /**
     * A {@code multiplier} (uses {@code factor}) or {@code rebase} (uses {@code baseYear},
     * {@code baseValue} and {@code scale}, default 100) conversion.
     */
    public record ConversionEntry(
            String type,
            String from,
            String to,
            String variableId,
            Double factor,
            Integer baseYear,
            Double baseValue,
            Double scale
    ) {}
}
