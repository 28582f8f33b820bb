package com.flagship.claims_ledger.settlement;

import lombok.Value;

import java.time.Instant;

/**
 * Proof of holding a lease. The token distinguishes this holder from whoever acquires the lease after expiry.
 */
@Value
public class LeaseHandle {
    String name;
    String token;
    Instant expiresAt;
}
