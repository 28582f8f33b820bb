package com.flagship.claims_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for a manual settlement of one vault's claims.
 */
@Value
@Builder
@Jacksonized
public class SettleClaimsRequest {

    @NotEmpty(message = "At least one claim ID is required")
    @Size(max = 50, message = "At most 50 claims can be settled at once")
    @JsonProperty("claim_ids")
    List<@NotNull(message = "Claim ID must not be null") UUID> claimIds;
}
