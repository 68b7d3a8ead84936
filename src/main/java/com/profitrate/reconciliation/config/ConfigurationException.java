package com.profitrate.reconciliation.config;

import com.profitrate.reconciliation.core.ReconciliationException;

/**
 * Thrown when a configuration entry is malformed or incomplete. Always fatal for the run
 * and always raised before any source is processed.
 */
public class ConfigurationException extends ReconciliationException {
    private final String key;

    public ConfigurationException(String key, String message) {
        super("Invalid configuration at '" + key + "': " + message);
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super("Invalid configuration at '" + key + "': " + message, cause);
        this.key = key;
    }

    /**
     * Path of the offending entry, e.g. {@code sources[2].path}.
     */
    public String getKey() {
        return key;
    }
}
