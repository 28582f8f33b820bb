package com.flagship.claims_ledger.claims.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact about claims of one vault, published through the outbox.
 */
public interface ClaimEvent {

    /** Unique per event instance, for consumer deduplication. */
    UUID getEventId();

    UUID getVaultId();

    Instant getOccurredAt();

    String getEventType();
}
