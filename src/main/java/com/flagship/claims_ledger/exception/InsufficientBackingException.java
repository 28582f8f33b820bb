package com.flagship.claims_ledger.exception;

/**
 * The output backing a claim is gone and was not consumed by an earlier settlement.
 */
public class InsufficientBackingException extends ClaimsLedgerException {

    public InsufficientBackingException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INSUFFICIENT_BACKING";
    }
}
