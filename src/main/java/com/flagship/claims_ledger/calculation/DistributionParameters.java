package com.flagship.claims_ledger.calculation;

import lombok.Builder;
import lombok.Value;

/**
 * Vault-level inputs of one allocation run.
 *
 * tokenSupply is already scaled to smallest units (supply * 10^decimals).
 * Currency totals are in display units; the calculator scales them by
 * {@link DistributionCalculator#UNIT_SCALE} when producing claim amounts.
 */
@Value
@Builder
public class DistributionParameters {
    double tokenSupply;
    double acquirerShare;
    double liquidityPoolShare;
    double acquiredCurrency;
    double contributedValue;
}
