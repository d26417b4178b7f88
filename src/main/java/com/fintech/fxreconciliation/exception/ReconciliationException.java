package com.fintech.fxreconciliation.exception;

/**
 * Base exception for reconciliation requests that cannot be processed.
 * Discrepancies and unmatched records are results, never exceptions.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
