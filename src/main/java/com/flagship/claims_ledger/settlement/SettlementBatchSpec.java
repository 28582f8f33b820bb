package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Everything the transaction builder needs to pay out one batch of claims of a single vault.
 */
@Value
@Builder
public class SettlementBatchSpec {
    UUID vaultId;
    String contractAddress;
    List<Payout> payouts;

    public List<UUID> claimIds() {
        return payouts.stream().map(Payout::getClaimId).toList();
    }

    @Value
    @Builder
    public static class Payout {
        UUID claimId;
        UUID participantId;
        ClaimType type;
        long tokenAmount;
        long currencyAmount;
        Long multiplier;
        String sourceTransactionRef;
        int outputIndex;

        static Payout of(Claim claim, String sourceTransactionRef) {
            return Payout.builder()
                .claimId(claim.getId())
                .participantId(claim.getParticipantId())
                .type(claim.getType())
                .tokenAmount(claim.getTokenAmount())
                .currencyAmount(claim.getCurrencyAmount())
                .multiplier(claim.getMultiplier())
                .sourceTransactionRef(sourceTransactionRef)
                .outputIndex(claim.getMetadata() != null ? claim.getMetadata().outputIndexOrDefault() : 0)
                .build();
        }
    }
}
