package com.flagship.claims_ledger.claims.metadata;

import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

@Getter
@SuperBuilder(toBuilder = true)
@Jacksonized
public class ContributorClaimMetadata extends ClaimMetadata {

    /** Assessed value of the contribution in display currency. */
    private final Double assessedValue;
    /** Fraction of the participant's total contribution. */
    private final Double proportion;
    /** Fraction of the vault's total contributed value. */
    private final Double share;
    private final Boolean noAcquirers;

    @Override
    public ClaimType claimType() {
        return ClaimType.CONTRIBUTOR;
    }
}
