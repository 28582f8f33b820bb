package com.flagship.claims_ledger.claims.metadata;

import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Refund of a contribution (assets) or an acquisition (currency) from a failed vault.
 */
@Getter
@SuperBuilder(toBuilder = true)
@Jacksonized
public class CancellationClaimMetadata extends ClaimMetadata {

    public static final String CONTRIBUTION = "contribution";
    public static final String ACQUISITION = "acquisition";

    private final String transactionType;
    private final String failureReason;
    private final List<RefundAsset> assets;

    @Override
    public ClaimType claimType() {
        return ClaimType.CANCELLATION;
    }

    public int assetCount() {
        return assets != null ? assets.size() : 0;
    }
}
