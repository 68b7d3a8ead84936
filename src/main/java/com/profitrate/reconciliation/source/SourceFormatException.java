package com.profitrate.reconciliation.source;

import com.profitrate.reconciliation.core.ReconciliationException;

/**
 * Thrown when a file does not match the extraction rule its descriptor declares.
 * Fatal for the source, not for the run.
 */
public class SourceFormatException extends ReconciliationException {
    private final String sourceId;

    public SourceFormatException(String sourceId, String message) {
        super("Source '" + sourceId + "': " + message);
        this.sourceId = sourceId;
    }

    public SourceFormatException(String sourceId, String message, Throwable cause) {
        super("Source '" + sourceId + "': " + message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
