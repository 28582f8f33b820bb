package com.flagship.claims_ledger.claims.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A batch of claims paid by one settlement transaction, or recovered as already paid.
 */
@Value
public class ClaimsSettledEvent implements ClaimEvent {
    UUID eventId;
    UUID vaultId;
    List<UUID> claimIds;
    String settlementReference;
    boolean recovered;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClaimsSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ClaimsSettledEvent of(UUID vaultId, List<UUID> claimIds, String reference, boolean recovered) {
        return new ClaimsSettledEvent(UUID.randomUUID(), vaultId, List.copyOf(claimIds), reference,
            recovered, Instant.now());
    }
}
