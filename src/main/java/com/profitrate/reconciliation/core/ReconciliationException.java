package com.profitrate.reconciliation.core;

/**
 * Base type for every failure raised by the reconciliation engine.
 * Subclasses identify the stage that failed so callers can decide whether
 * the failure is fatal for a single variable or for the whole run.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
