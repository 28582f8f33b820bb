package com.flagship.claims_ledger.vault;

public enum SourceTransactionStatus {
    CREATED,
    PENDING,
    SUBMITTED,
    CONFIRMED,
    FAILED,
    STUCK
}
