package com.flagship.claims_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("settlement_reference")
    String settlementReference;

    @JsonProperty("claim_ids")
    List<UUID> claimIds;
}
