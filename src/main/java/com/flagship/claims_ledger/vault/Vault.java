package com.flagship.claims_ledger.vault;

import com.flagship.claims_ledger.calculation.DistributionParameters;
import lombok.Value;

import java.util.UUID;

/**
 * Read-only view of a vault aggregate.
 *
 * Share percentages are stored in whole percent (e.g. 50 for one half).
 */
@Value
public class Vault {
    UUID id;
    UUID ownerId;
    String name;
    VaultStatus status;
    long tokenSupply;
    int tokenDecimals;
    double acquirerSharePercent;
    double liquidityPoolSharePercent;
    double totalAcquiredCurrency;
    double totalAssetsValue;
    String contractAddress;

    /**
     * Supply expressed in smallest token units.
     */
    public double scaledTokenSupply() {
        return tokenSupply * Math.pow(10, tokenDecimals);
    }

    public double acquirerShare() {
        return acquirerSharePercent * 0.01;
    }

    public double liquidityPoolShare() {
        return liquidityPoolSharePercent * 0.01;
    }

    public DistributionParameters toParameters(double acquiredCurrency, double contributedValue) {
        return DistributionParameters.builder()
                .tokenSupply(scaledTokenSupply())
                .acquirerShare(acquirerShare())
                .liquidityPoolShare(liquidityPoolShare())
                .acquiredCurrency(acquiredCurrency)
                .contributedValue(contributedValue)
                .build();
    }
}
