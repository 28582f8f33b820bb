package com.flagship.claims_ledger.claims.metadata;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * One asset returned to its contributor by a cancellation claim.
 */
@Value
@Builder
@Jacksonized
public class RefundAsset {
    UUID id;
    String policyId;
    String assetName;
    String assetType;
    long quantity;
}
