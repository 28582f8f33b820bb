package com.flagship.claims_ledger.claims.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class ClaimsFailedEvent implements ClaimEvent {
    UUID eventId;
    UUID vaultId;
    List<UUID> claimIds;
    String reason;
    int attempts;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClaimsFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ClaimsFailedEvent of(UUID vaultId, List<UUID> claimIds, String reason, int attempts) {
        return new ClaimsFailedEvent(UUID.randomUUID(), vaultId, List.copyOf(claimIds), reason,
            attempts, Instant.now());
    }
}
