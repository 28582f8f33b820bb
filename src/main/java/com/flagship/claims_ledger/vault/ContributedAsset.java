package com.flagship.claims_ledger.vault;

import com.flagship.claims_ledger.calculation.AssetQuantity;
import lombok.Value;

import java.util.UUID;

@Value
public class ContributedAsset {
    UUID id;
    UUID transactionId;
    String policyId;
    String assetName;
    String assetType;
    long quantity;
    double unitValue;
    AssetStatus status;

    public double assessedValue() {
        return unitValue * quantity;
    }

    public AssetQuantity toQuantity() {
        return new AssetQuantity(policyId, assetName, quantity);
    }
}
