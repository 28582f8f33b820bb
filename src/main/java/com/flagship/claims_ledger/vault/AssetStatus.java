package com.flagship.claims_ledger.vault;

public enum AssetStatus {
    LOCKED,
    DISTRIBUTED,
    RELEASED,
    EXTRACTED
}
