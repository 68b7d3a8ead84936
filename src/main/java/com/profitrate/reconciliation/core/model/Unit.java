package com.profitrate.reconciliation.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of measurement units a source may declare.
 */
public enum Unit {
    CURRENCY_MILLIONS("currency-millions"),
    CURRENCY_BILLIONS("currency-billions"),
    FRACTION("fraction-0to1"),
    PERCENT("percent-0to100"),
    INDEX("index");

    private final String wireName;

    Unit(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in configuration files and output CSVs.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a unit by its wire name or enum constant name, ignoring case.
     */
    public static Optional<Unit> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String candidate = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(u -> u.wireName.equals(candidate) || u.name().toLowerCase(Locale.ROOT).equals(candidate))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
