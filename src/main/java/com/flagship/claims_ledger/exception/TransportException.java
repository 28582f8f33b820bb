package com.flagship.claims_ledger.exception;

/**
 * Failure talking to an external collaborator (transaction builder, ledger query).
 * Always retryable.
 */
public class TransportException extends ClaimsLedgerException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "TRANSPORT_ERROR";
    }
}
