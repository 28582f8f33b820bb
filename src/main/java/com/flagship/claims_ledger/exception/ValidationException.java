package com.flagship.claims_ledger.exception;

/**
 * Input rejected before any state change.
 */
public class ValidationException extends ClaimsLedgerException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }
}
