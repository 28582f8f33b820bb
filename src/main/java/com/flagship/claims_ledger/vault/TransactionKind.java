package com.flagship.claims_ledger.vault;

public enum TransactionKind {
    CONTRIBUTE,
    ACQUIRE
}
