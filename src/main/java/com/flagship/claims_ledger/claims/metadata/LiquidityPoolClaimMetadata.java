package com.flagship.claims_ledger.claims.metadata;

import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

@Getter
@SuperBuilder(toBuilder = true)
@Jacksonized
public class LiquidityPoolClaimMetadata extends ClaimMetadata {

    private final Double fullyDilutedValuation;
    private final Double tokenPrice;
    private final Long pairMultiplier;
    /** LP token amount before pair-multiplier adjustment. */
    private final Double unadjustedTokenAmount;
    private final Double currencyAmount;

    @Override
    public ClaimType claimType() {
        return ClaimType.LIQUIDITY_POOL;
    }
}
