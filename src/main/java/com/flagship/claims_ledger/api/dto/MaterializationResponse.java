package com.flagship.claims_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.ClaimMaterializationService.MaterializationResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class MaterializationResponse {

    @JsonProperty("vault_id")
    UUID vaultId;

    @JsonProperty("created_claim_ids")
    List<UUID> createdClaimIds;

    int kept;

    int replaced;

    @JsonProperty("unallocated_tokens")
    Long unallocatedTokens;

    public static MaterializationResponse from(MaterializationResult result) {
        return MaterializationResponse.builder()
            .vaultId(result.getVaultId())
            .createdClaimIds(result.getCreated().stream().map(Claim::getId).toList())
            .kept(result.getKept())
            .replaced(result.getReplaced())
            .unallocatedTokens(result.getPlan() != null ? result.getPlan().unallocatedTokens() : null)
            .build();
    }
}
