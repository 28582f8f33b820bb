package com.flagship.claims_ledger.claims.metadata;

import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * Burn-and-redeem entitlement after a vault is terminated.
 */
@Getter
@SuperBuilder(toBuilder = true)
@Jacksonized
public class TerminationClaimMetadata extends ClaimMetadata {

    private final String address;
    private final Long tokensToBurn;
    private final Long currencyToReceive;
    private final Double tokenShare;
    private final Boolean noCurrencyDistribution;

    @Override
    public ClaimType claimType() {
        return ClaimType.TERMINATION;
    }
}
