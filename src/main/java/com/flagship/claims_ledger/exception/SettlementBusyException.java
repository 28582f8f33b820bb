package com.flagship.claims_ledger.exception;

/**
 * Another settlement run holds the settlement lease.
 */
public class SettlementBusyException extends ClaimsLedgerException {

    public SettlementBusyException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "SETTLEMENT_BUSY";
    }
}
