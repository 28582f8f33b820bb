package com.flagship.claims_ledger.vault;

/**
 * Lifecycle phase of a vault, owned by the external phase scheduler.
 */
public enum VaultStatus {
    DRAFT,
    PUBLISHED,
    CONTRIBUTION,
    ACQUIRE,
    LOCKED,
    BURNED,
    FAILED,
    TERMINATED
}
