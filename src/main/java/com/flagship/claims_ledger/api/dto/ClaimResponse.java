package com.flagship.claims_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.ClaimStatus;
import com.flagship.claims_ledger.claims.ClaimType;
import com.flagship.claims_ledger.claims.metadata.ClaimMetadata;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a single claim. Amounts are in smallest units.
 */
@Value
@Builder
public class ClaimResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("participant_id")
    UUID participantId;

    @JsonProperty("vault_id")
    UUID vaultId;

    @JsonProperty("type")
    ClaimType type;

    @JsonProperty("status")
    ClaimStatus status;

    @JsonProperty("token_amount")
    long tokenAmount;

    @JsonProperty("currency_amount")
    long currencyAmount;

    @JsonProperty("multiplier")
    Long multiplier;

    @JsonProperty("source_transaction_id")
    UUID sourceTransactionId;

    @JsonProperty("settlement_reference")
    String settlementReference;

    @JsonProperty("metadata")
    ClaimMetadata metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ClaimResponse from(Claim claim) {
        return ClaimResponse.builder()
            .id(claim.getId())
            .participantId(claim.getParticipantId())
            .vaultId(claim.getVaultId())
            .type(claim.getType())
            .status(claim.getStatus())
            .tokenAmount(claim.getTokenAmount())
            .currencyAmount(claim.getCurrencyAmount())
            .multiplier(claim.getMultiplier())
            .sourceTransactionId(claim.getSourceTransactionId())
            .settlementReference(claim.getSettlementReference())
            .metadata(claim.getMetadata())
            .createdAt(claim.getCreatedAt())
            .updatedAt(claim.getUpdatedAt())
            .build();
    }
}
