package com.flagship.claims_ledger.calculation;

import lombok.Value;

/**
 * An asset position inside one contribution, in contribution order.
 */
@Value
public class AssetQuantity {
    String policyId;
    String assetName;
    long quantity;
}
