package com.profitrate.reconciliation.source;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Table layouts a source file may declare.
 */
public enum SourceLayout {
    /** Variable labels in a label column, years across the header row. */
    WIDE("wide"),
    /** One row per observation with explicit year, variable and value columns. */
    LONG("long");

    private final String wireName;

    SourceLayout(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SourceLayout> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String candidate = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(l -> l.wireName.equals(candidate)).findFirst();
    }
}
