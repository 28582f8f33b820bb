package com.flagship.claims_ledger.claims.metadata;

import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

@Getter
@SuperBuilder(toBuilder = true)
@Jacksonized
public class SecondaryRewardClaimMetadata extends ClaimMetadata {

    private final String role;
    private final Integer month;
    private final Integer totalMonths;
    private final String snapshotId;

    @Override
    public ClaimType claimType() {
        return ClaimType.SECONDARY_REWARD;
    }
}
