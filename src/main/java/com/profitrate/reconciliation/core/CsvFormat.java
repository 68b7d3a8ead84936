package com.profitrate.reconciliation.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180 style helpers shared by the source adapter and the series writer.
 */
public final class CsvFormat {

    private CsvFormat() {
        // Utility class
    }

    /**
     * Splits one CSV line into fields, honouring double-quoted fields with embedded
     * commas and doubled quotes. Fields are trimmed.
     *
     * @throws IllegalArgumentException if a quoted field is not terminated
     */
    public static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
            i++;
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quoted field in line: " + line);
        }
        fields.add(current.toString().trim());
        return fields;
    }

    /**
     * Quotes a value if it contains a separator, quote or line break.
     */
    public static String escape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
