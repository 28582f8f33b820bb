package com.flagship.claims_ledger.calculation;

import lombok.Value;

/**
 * Liquidity-pool reserve and the valuation it was derived from.
 */
@Value
public class LiquidityPoolAllocation {
    double fullyDilutedValuation;
    double currencyAmount;
    double tokenAmount;
    double tokenPrice;
    long pairMultiplier;
    long adjustedTokenAmount;

    static LiquidityPoolAllocation none(double fullyDilutedValuation, double tokenPrice) {
        return new LiquidityPoolAllocation(fullyDilutedValuation, 0, 0, tokenPrice, 0, 0);
    }

    /**
     * LP currency in smallest units.
     */
    public long currencyUnits() {
        return Rounding.floorToUnit(currencyAmount * DistributionCalculator.UNIT_SCALE);
    }

    /**
     * An LP claim exists only when both sides of the pair are funded.
     */
    public boolean isClaimable() {
        return currencyAmount > 0 && tokenAmount > 0;
    }
}
