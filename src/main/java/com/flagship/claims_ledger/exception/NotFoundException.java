package com.flagship.claims_ledger.exception;

/**
 * Unknown vault, claim or transaction.
 */
public class NotFoundException extends ClaimsLedgerException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
