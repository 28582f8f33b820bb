package com.flagship.claims_ledger.exception;

/**
 * A settlement batch does not fit the external ledger's transaction byte budget.
 */
public class SizeLimitExceededException extends ClaimsLedgerException {

    public SizeLimitExceededException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "SIZE_LIMIT_EXCEEDED";
    }
}
