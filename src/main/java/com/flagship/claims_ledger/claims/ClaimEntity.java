package com.flagship.claims_ledger.claims;

import com.flagship.claims_ledger.claims.metadata.ClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.ClaimMetadataCodec;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for claims.
 *
 * No setters. Amounts, owner and source transaction are not updatable;
 * status, metadata and settlement reference change through
 * {@link #updateFromDomain(Claim, ClaimMetadataCodec)} only.
 */
@Entity
@Table(
    name = "claims",
    indexes = {
        @Index(name = "idx_claims_participant", columnList = "participant_id"),
        @Index(name = "idx_claims_vault_status", columnList = "vault_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClaimEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "participant_id", nullable = false, updatable = false)
    private UUID participantId;

    @Column(name = "vault_id", nullable = false, updatable = false)
    private UUID vaultId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private ClaimType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ClaimStatus status;

    @Column(name = "token_amount", nullable = false, updatable = false)
    private long tokenAmount;

    @Column(name = "currency_amount", nullable = false, updatable = false)
    private long currencyAmount;

    @Column(name = "multiplier", updatable = false)
    private Long multiplier;

    @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String metadata;

    @Column(name = "source_transaction_id", updatable = false)
    private UUID sourceTransactionId;

    @Column(name = "settlement_reference")
    private String settlementReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ClaimEntity fromDomain(Claim claim, ClaimMetadataCodec codec) {
        return new ClaimEntity(
            claim.getId(),
            claim.getParticipantId(),
            claim.getVaultId(),
            claim.getType(),
            claim.getStatus(),
            claim.getTokenAmount(),
            claim.getCurrencyAmount(),
            claim.getMultiplier(),
            codec.write(claim.getMetadata()),
            claim.getSourceTransactionId(),
            claim.getSettlementReference(),
            null, // set by @PrePersist
            null
        );
    }

    public Claim toDomain(ClaimMetadataCodec codec) {
        ClaimMetadata parsed = codec.read(metadata);
        return Claim.builder()
            .id(id)
            .participantId(participantId)
            .vaultId(vaultId)
            .type(type)
            .status(status)
            .tokenAmount(tokenAmount)
            .currencyAmount(currencyAmount)
            .multiplier(multiplier)
            .metadata(parsed)
            .sourceTransactionId(sourceTransactionId)
            .settlementReference(settlementReference)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable fields. Amounts are never copied back.
     */
    void updateFromDomain(Claim claim, ClaimMetadataCodec codec) {
        this.status = claim.getStatus();
        this.metadata = codec.write(claim.getMetadata());
        this.settlementReference = claim.getSettlementReference();
    }
}
