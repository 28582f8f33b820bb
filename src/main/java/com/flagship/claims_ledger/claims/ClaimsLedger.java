package com.flagship.claims_ledger.claims;

import com.flagship.claims_ledger.claims.event.ClaimsFailedEvent;
import com.flagship.claims_ledger.claims.event.ClaimsSettledEvent;
import com.flagship.claims_ledger.claims.metadata.ClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.ClaimMetadataCodec;
import com.flagship.claims_ledger.exception.DuplicateClaimException;
import com.flagship.claims_ledger.exception.InvalidTransitionException;
import com.flagship.claims_ledger.exception.NotFoundException;
import com.flagship.claims_ledger.exception.ValidationException;
import com.flagship.claims_ledger.observability.ClaimsMetrics;
import com.flagship.claims_ledger.outbox.OutboxService;
import com.flagship.claims_ledger.vault.AssetStatus;
import com.flagship.claims_ledger.vault.AssetStatusUpdater;
import com.flagship.claims_ledger.vault.ContributedAsset;
import com.flagship.claims_ledger.vault.VaultReadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * System of record for claims.
 *
 * Every status change goes through {@link ClaimStateMachine}. Batch operations
 * used by settlement run in one transaction, so a batch moves as a unit: either
 * every claim changes status or none does.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimsLedger {

    static final String AUTO_MARKED_REASON = "utxo_already_consumed";

    private final ClaimRepository repository;
    private final ClaimMetadataCodec codec;
    private final AssetStatusUpdater assetStatusUpdater;
    private final VaultReadService vaultReadService;
    private final OutboxService outboxService;
    private final ClaimsMetrics metrics;

    /**
     * Records a new AVAILABLE claim.
     *
     * @throws ValidationException     for negative amounts, missing owner or vault, or mismatched metadata
     * @throws DuplicateClaimException if a non-failed claim exists for the same participant, transaction and type
     */
    @Transactional
    public Claim createClaim(UUID participantId, UUID vaultId, ClaimType type,
                             long tokenAmount, long currencyAmount,
                             UUID sourceTransactionId, ClaimMetadata metadata) {
        return createClaim(NewClaim.builder()
            .participantId(participantId)
            .vaultId(vaultId)
            .type(type)
            .tokenAmount(tokenAmount)
            .currencyAmount(currencyAmount)
            .sourceTransactionId(sourceTransactionId)
            .metadata(metadata)
            .build());
    }

    @Transactional
    public Claim createClaim(NewClaim request) {
        validate(request);
        checkNotDuplicate(request);

        Claim claim = Claim.builder()
            .id(UUID.randomUUID())
            .participantId(request.getParticipantId())
            .vaultId(request.getVaultId())
            .type(request.getType())
            .status(ClaimStatus.AVAILABLE)
            .tokenAmount(request.getTokenAmount())
            .currencyAmount(request.getCurrencyAmount())
            .multiplier(request.getMultiplier())
            .metadata(request.getMetadata())
            .sourceTransactionId(request.getSourceTransactionId())
            .build();

        ClaimEntity saved;
        try {
            saved = repository.saveAndFlush(ClaimEntity.fromDomain(claim, codec));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateClaimException(String.format(
                "Claim already exists for participant %s, transaction %s, type %s",
                request.getParticipantId(), request.getSourceTransactionId(), request.getType()));
        }

        metrics.recordCreated(request.getType(), 1);
        log.debug("Created {} claim {} for participant {}: tokens={}, currency={}",
            claim.getType(), claim.getId(), claim.getParticipantId(),
            claim.getTokenAmount(), claim.getCurrencyAmount());
        return saved.toDomain(codec);
    }

    /**
     * Moves one claim along an allowed edge. Same-status requests are no-ops.
     *
     * @throws NotFoundException          if the claim does not exist
     * @throws InvalidTransitionException if the edge is not allowed
     */
    @Transactional
    public Claim transition(UUID claimId, ClaimStatus newStatus) {
        ClaimEntity entity = findEntity(claimId);
        Claim current = entity.toDomain(codec);
        Claim next = current.transitionTo(newStatus);
        if (next == current) {
            return current;
        }
        if (newStatus == ClaimStatus.CLAIMED) {
            onClaimed(next);
        }
        return persist(entity, next);
    }

    /**
     * @throws NotFoundException   if the claim does not exist
     * @throws ValidationException if the patch does not fit the claim's metadata variant
     */
    @Transactional
    public Claim mergeMetadata(UUID claimId, Map<String, ?> patch) {
        ClaimEntity entity = findEntity(claimId);
        Claim current = entity.toDomain(codec);
        ClaimMetadata merged = codec.merge(current.getMetadata(), patch);
        return persist(entity, current.withMetadata(merged));
    }

    @Transactional(readOnly = true)
    public Claim getClaim(UUID claimId) {
        return findEntity(claimId).toDomain(codec);
    }

    /**
     * Loads claims by id, failing if any is unknown.
     */
    @Transactional(readOnly = true)
    public List<Claim> getClaims(Collection<UUID> claimIds) {
        return loadAll(claimIds).values().stream()
            .map(entity -> entity.toDomain(codec))
            .toList();
    }

    @Transactional(readOnly = true)
    public Page<Claim> getClaims(UUID participantId, ClaimFilter filter, Pageable pageable) {
        if (participantId == null) {
            throw new ValidationException("participantId is required");
        }
        ClaimFilter effective = filter != null ? filter : ClaimFilter.none();
        return repository.findAll(effective.toSpecification(participantId), pageable)
            .map(entity -> entity.toDomain(codec));
    }

    @Transactional(readOnly = true)
    public List<Claim> getVaultClaims(UUID vaultId) {
        return repository.findByVaultIdOrderByCreatedAtAsc(vaultId).stream()
            .map(entity -> entity.toDomain(codec))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Claim> findSettlementCandidates(Collection<ClaimType> types, int limit) {
        return repository.findAvailableForSettlement(types, PageRequest.of(0, limit)).stream()
            .map(entity -> entity.toDomain(codec))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Claim> findStalePending(Instant updatedBefore) {
        return repository.findPendingUpdatedBefore(updatedBefore).stream()
            .map(entity -> entity.toDomain(codec))
            .toList();
    }

    /**
     * AVAILABLE to PENDING for a whole batch, stamping the attempt time.
     *
     * @throws InvalidTransitionException if any claim is no longer AVAILABLE; no claim of the batch changes
     */
    @Transactional
    public List<Claim> markPending(Collection<UUID> claimIds, Instant at) {
        Map<UUID, ClaimEntity> entities = loadAll(claimIds, repository::findByIdInForUpdate);
        List<UUID> notAvailable = entities.values().stream()
            .filter(entity -> entity.getStatus() != ClaimStatus.AVAILABLE)
            .map(ClaimEntity::getId)
            .toList();
        if (!notAvailable.isEmpty()) {
            throw new InvalidTransitionException("Claims are no longer AVAILABLE and cannot be marked PENDING: "
                + notAvailable);
        }
        List<Claim> result = new ArrayList<>(entities.size());
        for (ClaimEntity entity : entities.values()) {
            Claim current = entity.toDomain(codec);
            Claim pending = current.transitionTo(ClaimStatus.PENDING)
                .withMetadata(codec.merge(current.getMetadata(), Map.of("lastAttemptAt", at)));
            result.add(persist(entity, pending));
        }
        return result;
    }

    /**
     * PENDING to CLAIMED for a whole batch paid by one settlement transaction.
     */
    @Transactional
    public List<Claim> completeSettlement(Collection<UUID> claimIds, String settlementReference) {
        if (settlementReference == null || settlementReference.isBlank()) {
            throw new ValidationException("Settlement reference is required");
        }
        Map<UUID, ClaimEntity> entities = loadAll(claimIds);
        List<Claim> result = new ArrayList<>(entities.size());
        for (ClaimEntity entity : entities.values()) {
            Claim claimed = entity.toDomain(codec).markClaimed(settlementReference);
            onClaimed(claimed);
            result.add(persist(entity, claimed));
            metrics.recordSettled(claimed.getType());
        }
        publishPerVault(result, (vaultId, ids) ->
            outboxService.saveEvent(ClaimsSettledEvent.of(vaultId, ids, settlementReference, false)));
        log.info("Settled {} claims with reference {}", result.size(), settlementReference);
        return result;
    }

    /**
     * Marks every claim of a batch FAILED and records why.
     */
    @Transactional
    public List<Claim> failAll(Collection<UUID> claimIds, String reason, int attempts, Instant at) {
        Map<UUID, ClaimEntity> entities = loadAll(claimIds);
        List<Claim> result = new ArrayList<>(entities.size());
        for (ClaimEntity entity : entities.values()) {
            Claim current = entity.toDomain(codec);
            Map<String, Object> patch = new HashMap<>();
            patch.put("error", reason);
            patch.put("settlementAttempts", attempts);
            patch.put("lastAttemptAt", at);
            Claim failed = current.transitionTo(ClaimStatus.FAILED)
                .withMetadata(codec.merge(current.getMetadata(), patch));
            result.add(persist(entity, failed));
            metrics.recordFailed(failed.getType(), reason);
        }
        publishPerVault(result, (vaultId, ids) ->
            outboxService.saveEvent(ClaimsFailedEvent.of(vaultId, ids, reason, attempts)));
        log.warn("Failed {} claims after {} attempts: {}", result.size(), attempts, reason);
        return result;
    }

    /**
     * Marks a claim CLAIMED because its backing output was already consumed,
     * meaning it was paid outside this run. The only AVAILABLE to CLAIMED path.
     */
    @Transactional
    public Claim recoverAsClaimed(UUID claimId, String consumedBy) {
        ClaimEntity entity = findEntity(claimId);
        Claim current = entity.toDomain(codec);

        Map<String, Object> patch = new HashMap<>();
        patch.put("autoMarkedReason", AUTO_MARKED_REASON);
        patch.put("consumedBy", consumedBy);
        Claim recovered = current.recoverAsClaimed(consumedBy, codec.merge(current.getMetadata(), patch));

        onClaimed(recovered);
        Claim saved = persist(entity, recovered);
        metrics.recordRecovered(saved.getType());
        outboxService.saveEvent(ClaimsSettledEvent.of(saved.getVaultId(), List.of(saved.getId()), consumedBy, true));
        log.info("Recovered claim {} as claimed: backing consumed by {}", claimId, consumedBy);
        return saved;
    }

    /**
     * Deletes a still-AVAILABLE claim superseded by a recomputed entitlement.
     */
    @Transactional
    public void removeObsolete(UUID claimId) {
        ClaimEntity entity = findEntity(claimId);
        if (entity.getStatus() != ClaimStatus.AVAILABLE) {
            throw new InvalidTransitionException(String.format(
                "Claim %s in %s status cannot be removed", claimId, entity.getStatus()));
        }
        repository.delete(entity);
        repository.flush();
        log.info("Removed obsolete claim {}", claimId);
    }

    private void onClaimed(Claim claim) {
        if (claim.getType() != ClaimType.ACQUIRER || claim.getSourceTransactionId() == null) {
            return;
        }
        List<UUID> assetIds = vaultReadService.findTransaction(claim.getSourceTransactionId())
            .map(tx -> tx.getAssets().stream()
                .filter(asset -> asset.getStatus() == AssetStatus.LOCKED)
                .map(ContributedAsset::getId)
                .toList())
            .orElse(List.of());
        if (!assetIds.isEmpty()) {
            assetStatusUpdater.markDistributed(assetIds);
        }
    }

    private void validate(NewClaim request) {
        if (request.getParticipantId() == null || request.getVaultId() == null || request.getType() == null) {
            throw new ValidationException("participantId, vaultId and type are required");
        }
        if (request.getTokenAmount() < 0 || request.getCurrencyAmount() < 0) {
            throw new ValidationException(String.format(
                "Claim amounts must be non-negative: tokens=%d, currency=%d",
                request.getTokenAmount(), request.getCurrencyAmount()));
        }
        if (request.getMultiplier() != null && request.getType() != ClaimType.ACQUIRER) {
            throw new ValidationException("Only acquirer claims carry a multiplier");
        }
        if (request.getMetadata() == null || request.getMetadata().claimType() != request.getType()) {
            throw new ValidationException("Metadata must match claim type " + request.getType());
        }
    }

    private void checkNotDuplicate(NewClaim request) {
        boolean exists = request.getSourceTransactionId() != null
            ? repository.existsActiveForTransaction(
                request.getParticipantId(), request.getSourceTransactionId(), request.getType())
            : request.getType() == ClaimType.LIQUIDITY_POOL
                && repository.existsActiveForVault(request.getVaultId(), request.getType());
        if (exists) {
            throw new DuplicateClaimException(String.format(
                "Claim already exists for participant %s, transaction %s, type %s",
                request.getParticipantId(), request.getSourceTransactionId(), request.getType()));
        }
    }

    private ClaimEntity findEntity(UUID claimId) {
        return repository.findById(claimId)
            .orElseThrow(() -> new NotFoundException("Claim not found: " + claimId));
    }

    private Map<UUID, ClaimEntity> loadAll(Collection<UUID> claimIds) {
        return loadAll(claimIds, repository::findByIdIn);
    }

    private Map<UUID, ClaimEntity> loadAll(Collection<UUID> claimIds,
                                           Function<Collection<UUID>, List<ClaimEntity>> finder) {
        Set<UUID> wanted = new LinkedHashSet<>(claimIds);
        Map<UUID, ClaimEntity> found = finder.apply(wanted).stream()
            .collect(Collectors.toMap(ClaimEntity::getId, Function.identity()));
        List<UUID> missing = wanted.stream().filter(id -> !found.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new NotFoundException("Claims not found: " + missing);
        }
        return wanted.stream().collect(Collectors.toMap(
            Function.identity(), found::get, (a, b) -> a, LinkedHashMap::new));
    }

    private Claim persist(ClaimEntity entity, Claim claim) {
        entity.updateFromDomain(claim, codec);
        return repository.save(entity).toDomain(codec);
    }

    private void publishPerVault(List<Claim> claims, VaultEventWriter writer) {
        claims.stream()
            .collect(Collectors.groupingBy(Claim::getVaultId,
                Collectors.mapping(Claim::getId, Collectors.toList())))
            .forEach(writer::write);
    }

    @FunctionalInterface
    private interface VaultEventWriter {
        void write(UUID vaultId, List<UUID> claimIds);
    }
}
