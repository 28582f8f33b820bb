package com.flagship.claims_ledger.claims;

import com.flagship.claims_ledger.claims.metadata.ClaimMetadata;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Entitlement of one participant, settled by an external-ledger transaction.
 *
 * Immutable: status changes produce a new instance. Amounts are whole
 * smallest units and never change after creation.
 */
@Value
@Builder(toBuilder = true)
public class Claim {
    UUID id;
    UUID participantId;
    UUID vaultId;
    ClaimType type;
    ClaimStatus status;
    long tokenAmount;
    long currencyAmount;
    Long multiplier;
    ClaimMetadata metadata;
    UUID sourceTransactionId;
    String settlementReference;
    Instant createdAt;
    Instant updatedAt;

    /**
     * @throws com.flagship.claims_ledger.exception.InvalidTransitionException if the edge is not allowed
     */
    public Claim transitionTo(ClaimStatus target) {
        if (status == target) {
            return this;
        }
        ClaimStateMachine.checkTransition(id, status, target);
        return toBuilder().status(target).updatedAt(Instant.now()).build();
    }

    public Claim markClaimed(String reference) {
        Claim claimed = transitionTo(ClaimStatus.CLAIMED);
        return claimed.toBuilder().settlementReference(reference).build();
    }

    public Claim recoverAsClaimed(String consumedBy, ClaimMetadata recoveredMetadata) {
        ClaimStateMachine.checkRecovery(id, status);
        return toBuilder()
            .status(ClaimStatus.CLAIMED)
            .settlementReference(consumedBy)
            .metadata(recoveredMetadata)
            .updatedAt(Instant.now())
            .build();
    }

    public Claim withMetadata(ClaimMetadata newMetadata) {
        return toBuilder().metadata(newMetadata).build();
    }
}
