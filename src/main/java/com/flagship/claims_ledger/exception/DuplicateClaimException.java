package com.flagship.claims_ledger.exception;

/**
 * A non-failed claim already exists for the same participant, transaction and type.
 */
public class DuplicateClaimException extends ClaimsLedgerException {

    public DuplicateClaimException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "DUPLICATE_CLAIM";
    }
}
