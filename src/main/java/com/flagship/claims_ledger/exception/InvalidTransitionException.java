package com.flagship.claims_ledger.exception;

/**
 * Requested status change is not an allowed edge of the claim lifecycle.
 */
public class InvalidTransitionException extends ClaimsLedgerException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_TRANSITION";
    }
}
