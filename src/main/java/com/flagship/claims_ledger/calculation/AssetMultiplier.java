package com.flagship.claims_ledger.calculation;

import lombok.Value;

/**
 * Per-unit payout for one contributed asset.
 * The settlement contract pays quantity * multiplier, so token and currency
 * amounts reconstructed from these values may be slightly below the claim.
 */
@Value
public class AssetMultiplier {
    String policyId;
    String assetName;
    long quantity;
    long tokensPerUnit;
    long currencyPerUnit;

    public long reconstructedTokens() {
        return quantity * tokensPerUnit;
    }
}
