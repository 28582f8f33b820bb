package com.flagship.claims_ledger.claims.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class ClaimsCreatedEvent implements ClaimEvent {
    UUID eventId;
    UUID vaultId;
    List<UUID> claimIds;
    long totalTokens;
    long totalCurrency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClaimsCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ClaimsCreatedEvent of(UUID vaultId, List<UUID> claimIds, long totalTokens, long totalCurrency) {
        return new ClaimsCreatedEvent(UUID.randomUUID(), vaultId, List.copyOf(claimIds),
            totalTokens, totalCurrency, Instant.now());
    }
}
