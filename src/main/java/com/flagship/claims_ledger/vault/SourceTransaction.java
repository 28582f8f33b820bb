package com.flagship.claims_ledger.vault;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * A contribution or acquisition into a vault.
 * currencyAmount is set for acquisitions only; assets for contributions only.
 */
@Value
public class SourceTransaction {
    UUID id;
    UUID vaultId;
    UUID participantId;
    TransactionKind kind;
    SourceTransactionStatus status;
    double currencyAmount;
    String externalRef;
    List<ContributedAsset> assets;

    public boolean isContribution() {
        return kind == TransactionKind.CONTRIBUTE;
    }

    public boolean isAcquisition() {
        return kind == TransactionKind.ACQUIRE;
    }

    public double assessedValue() {
        return assets.stream().mapToDouble(ContributedAsset::assessedValue).sum();
    }

    public SourceTransaction withAssets(List<ContributedAsset> assets) {
        return new SourceTransaction(id, vaultId, participantId, kind, status, currencyAmount, externalRef,
                List.copyOf(assets));
    }
}
