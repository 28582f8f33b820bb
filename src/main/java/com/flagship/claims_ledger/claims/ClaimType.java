package com.flagship.claims_ledger.claims;

public enum ClaimType {
    CONTRIBUTOR,
    ACQUIRER,
    LIQUIDITY_POOL,
    CANCELLATION,
    TERMINATION,
    SECONDARY_REWARD
}
