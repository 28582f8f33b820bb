package com.flagship.claims_ledger.claims;

/**
 * Claim lifecycle.
 *
 * AVAILABLE -> PENDING -> CLAIMED
 *     |           |
 *     +-----------+-> FAILED
 *
 * CLAIMED and FAILED are terminal.
 */
public enum ClaimStatus {
    AVAILABLE,
    PENDING,
    CLAIMED,
    FAILED
}
