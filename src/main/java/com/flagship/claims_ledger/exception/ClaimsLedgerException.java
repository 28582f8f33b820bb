package com.flagship.claims_ledger.exception;

/**
 * Base type for every failure the claims core reports to callers.
 */
public abstract class ClaimsLedgerException extends RuntimeException {

    protected ClaimsLedgerException(String message) {
        super(message);
    }

    protected ClaimsLedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable code used in API error responses.
     */
    public abstract String getErrorCode();
}
