package com.flagship.claims_ledger.claims.metadata;

import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

@Getter
@SuperBuilder(toBuilder = true)
@Jacksonized
public class AcquirerClaimMetadata extends ClaimMetadata {

    private final Double currencySent;
    private final Double percentOfTotal;
    /** Multiplier before vault-wide normalization. */
    private final Long rawMultiplier;

    @Override
    public ClaimType claimType() {
        return ClaimType.ACQUIRER;
    }
}
