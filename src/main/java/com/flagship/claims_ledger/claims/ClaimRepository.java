package com.flagship.claims_ledger.claims;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ClaimRepository extends JpaRepository<ClaimEntity, UUID>, JpaSpecificationExecutor<ClaimEntity> {

    /**
     * Duplicate guard: any claim for the pair that has not failed.
     */
    @Query("""
        SELECT CASE WHEN COUNT(c) > 0 THEN true ELSE false END FROM ClaimEntity c
        WHERE c.participantId = :participantId
          AND c.sourceTransactionId = :sourceTransactionId
          AND c.type = :type
          AND c.status <> com.flagship.claims_ledger.claims.ClaimStatus.FAILED
        """)
    boolean existsActiveForTransaction(@Param("participantId") UUID participantId,
                                       @Param("sourceTransactionId") UUID sourceTransactionId,
                                       @Param("type") ClaimType type);

    @Query("""
        SELECT CASE WHEN COUNT(c) > 0 THEN true ELSE false END FROM ClaimEntity c
        WHERE c.vaultId = :vaultId
          AND c.type = :type
          AND c.sourceTransactionId IS NULL
          AND c.status <> com.flagship.claims_ledger.claims.ClaimStatus.FAILED
        """)
    boolean existsActiveForVault(@Param("vaultId") UUID vaultId, @Param("type") ClaimType type);

    List<ClaimEntity> findByVaultIdOrderByCreatedAtAsc(UUID vaultId);

    List<ClaimEntity> findByIdIn(Collection<UUID> ids);

    /**
     * Row-locks the claims until the surrounding transaction ends, so two
     * settlements cannot both move the same claim to PENDING.
     */
    @Query(value = """
        SELECT * FROM claims
        WHERE id IN (:ids)
        FOR UPDATE
        """, nativeQuery = true)
    List<ClaimEntity> findByIdInForUpdate(@Param("ids") Collection<UUID> ids);

    /**
     * Settlement candidates, oldest first.
     */
    @Query("""
        SELECT c FROM ClaimEntity c
        WHERE c.status = com.flagship.claims_ledger.claims.ClaimStatus.AVAILABLE
          AND c.type IN :types
        ORDER BY c.createdAt ASC
        """)
    List<ClaimEntity> findAvailableForSettlement(@Param("types") Collection<ClaimType> types, Pageable pageable);

    @Query("""
        SELECT c FROM ClaimEntity c
        WHERE c.status = com.flagship.claims_ledger.claims.ClaimStatus.PENDING
          AND c.updatedAt < :before
        ORDER BY c.updatedAt ASC
        """)
    List<ClaimEntity> findPendingUpdatedBefore(@Param("before") Instant before);

    long countByStatus(ClaimStatus status);
}
