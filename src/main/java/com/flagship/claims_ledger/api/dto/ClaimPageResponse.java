package com.flagship.claims_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.claims_ledger.claims.Claim;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;

@Value
@Builder
public class ClaimPageResponse {

    @JsonProperty("items")
    List<ClaimResponse> items;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total")
    long total;

    @JsonProperty("total_pages")
    int totalPages;

    public static ClaimPageResponse from(Page<Claim> page) {
        return ClaimPageResponse.builder()
            .items(page.getContent().stream().map(ClaimResponse::from).toList())
            .page(page.getNumber())
            .size(page.getSize())
            .total(page.getTotalElements())
            .totalPages(page.getTotalPages())
            .build();
    }
}
