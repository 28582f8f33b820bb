package com.flagship.claims_ledger.claims;

import com.flagship.claims_ledger.claims.metadata.ClaimMetadata;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Request to record one entitlement.
 */
@Value
@Builder
public class NewClaim {
    UUID participantId;
    UUID vaultId;
    ClaimType type;
    long tokenAmount;
    long currencyAmount;
    Long multiplier;
    UUID sourceTransactionId;
    ClaimMetadata metadata;
}
