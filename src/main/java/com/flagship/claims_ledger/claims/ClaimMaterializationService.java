package com.flagship.claims_ledger.claims;

import com.flagship.claims_ledger.calculation.AcquirerAllocation;
import com.flagship.claims_ledger.calculation.ContributorAllocation;
import com.flagship.claims_ledger.calculation.DistributionCalculator;
import com.flagship.claims_ledger.calculation.DistributionPlan;
import com.flagship.claims_ledger.calculation.LiquidityPoolAllocation;
import com.flagship.claims_ledger.calculation.Rounding;
import com.flagship.claims_ledger.claims.event.ClaimsCreatedEvent;
import com.flagship.claims_ledger.claims.metadata.AcquirerClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.CancellationClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.ContributorClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.LiquidityPoolClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.RefundAsset;
import com.flagship.claims_ledger.exception.ValidationException;
import com.flagship.claims_ledger.outbox.OutboxService;
import com.flagship.claims_ledger.vault.SourceTransaction;
import com.flagship.claims_ledger.vault.Vault;
import com.flagship.claims_ledger.vault.VaultReadService;
import com.flagship.claims_ledger.vault.VaultStatus;
import com.flagship.claims_ledger.vault.VaultTotals;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Creates the claims of a vault once its contribution and acquisition windows close.
 *
 * Re-running is safe: an existing claim with the recomputed amounts is kept,
 * a still-AVAILABLE claim with different amounts is replaced, and claims that
 * already left AVAILABLE are never touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimMaterializationService {

    private final VaultReadService vaultReadService;
    private final DistributionPlanner planner;
    private final ClaimsLedger ledger;
    private final OutboxService outboxService;

    /**
     * Entry point for the phase scheduler, with the totals it has already computed.
     */
    @Transactional
    public MaterializationResult createClaimsForVault(UUID vaultId, VaultTotals totals) {
        Vault vault = vaultReadService.getVault(vaultId);
        List<SourceTransaction> transactions = vaultReadService.findConfirmedTransactions(vaultId);
        DistributionPlan plan = planner.plan(vault, transactions, totals);
        return materialize(vault, plan);
    }

    /**
     * Derives totals from the vault's confirmed transactions.
     */
    @Transactional
    public MaterializationResult createClaimsForVault(UUID vaultId) {
        Vault vault = vaultReadService.getVault(vaultId);
        List<SourceTransaction> transactions = vaultReadService.findConfirmedTransactions(vaultId);
        DistributionPlan plan = planner.plan(vault, transactions);
        return materialize(vault, plan);
    }

    /**
     * Refund claims for a failed vault: assets back to contributors, currency back to acquirers.
     */
    @Transactional
    public MaterializationResult createCancellationClaims(UUID vaultId, String reason) {
        Vault vault = vaultReadService.getVault(vaultId);
        if (vault.getStatus() != VaultStatus.FAILED) {
            throw new ValidationException("Vault " + vaultId + " is " + vault.getStatus()
                + "; cancellation claims require a FAILED vault");
        }

        Map<UUID, Claim> existing = existingByTransaction(vaultId, ClaimType.CANCELLATION);
        List<Claim> created = new ArrayList<>();
        int kept = 0;

        for (SourceTransaction tx : vaultReadService.findConfirmedTransactions(vaultId)) {
            if (existing.containsKey(tx.getId())) {
                kept++;
                continue;
            }
            CancellationClaimMetadata.CancellationClaimMetadataBuilder<?, ?> metadata = CancellationClaimMetadata.builder()
                .failureReason(reason)
                .outputIndex(0);
            long currency = 0;
            if (tx.isContribution()) {
                metadata.transactionType(CancellationClaimMetadata.CONTRIBUTION)
                    .assets(tx.getAssets().stream()
                        .map(asset -> RefundAsset.builder()
                            .id(asset.getId())
                            .policyId(asset.getPolicyId())
                            .assetName(asset.getAssetName())
                            .assetType(asset.getAssetType())
                            .quantity(asset.getQuantity())
                            .build())
                        .toList());
            } else {
                metadata.transactionType(CancellationClaimMetadata.ACQUISITION);
                currency = Rounding.floorToUnit(tx.getCurrencyAmount() * DistributionCalculator.UNIT_SCALE);
            }

            created.add(ledger.createClaim(NewClaim.builder()
                .participantId(tx.getParticipantId())
                .vaultId(vaultId)
                .type(ClaimType.CANCELLATION)
                .tokenAmount(0)
                .currencyAmount(currency)
                .sourceTransactionId(tx.getId())
                .metadata(metadata.build())
                .build()));
        }

        publishCreated(vaultId, created);
        log.info("Created {} cancellation claims for vault {} ({} already present)", created.size(), vaultId, kept);
        return new MaterializationResult(vaultId, null, created, kept, 0);
    }

    private MaterializationResult materialize(Vault vault, DistributionPlan plan) {
        UUID vaultId = vault.getId();
        Map<UUID, Claim> acquirerClaims = existingByTransaction(vaultId, ClaimType.ACQUIRER);
        Map<UUID, Claim> contributorClaims = existingByTransaction(vaultId, ClaimType.CONTRIBUTOR);

        Tally tally = new Tally();

        for (AcquirerAllocation allocation : plan.getAcquirers()) {
            NewClaim request = NewClaim.builder()
                .participantId(allocation.getParticipantId())
                .vaultId(vaultId)
                .type(ClaimType.ACQUIRER)
                .tokenAmount(allocation.getTokenAmount())
                .currencyAmount(0)
                .multiplier(allocation.getMultiplier())
                .sourceTransactionId(allocation.getTransactionId())
                .metadata(AcquirerClaimMetadata.builder()
                    .currencySent(allocation.getCurrencySent())
                    .percentOfTotal(allocation.getPercentOfTotal())
                    .rawMultiplier(allocation.getRawMultiplier())
                    .outputIndex(0)
                    .build())
                .build();
            upsert(Optional.ofNullable(acquirerClaims.get(allocation.getTransactionId())), request, tally);
        }

        boolean noAcquirers = plan.getAcquirers().isEmpty();
        for (ContributorAllocation allocation : plan.getContributors()) {
            NewClaim request = NewClaim.builder()
                .participantId(allocation.getParticipantId())
                .vaultId(vaultId)
                .type(ClaimType.CONTRIBUTOR)
                .tokenAmount(allocation.getTokenAmount())
                .currencyAmount(allocation.getCurrencyAmount())
                .sourceTransactionId(allocation.getTransactionId())
                .metadata(ContributorClaimMetadata.builder()
                    .assessedValue(allocation.getAssessedValue())
                    .proportion(allocation.getProportion())
                    .share(allocation.getShare())
                    .noAcquirers(noAcquirers)
                    .outputIndex(0)
                    .build())
                .build();
            upsert(Optional.ofNullable(contributorClaims.get(allocation.getTransactionId())), request, tally);
        }

        LiquidityPoolAllocation lp = plan.getLiquidityPool();
        if (lp.isClaimable()) {
            Optional<Claim> existingLp = ledger.getVaultClaims(vaultId).stream()
                .filter(c -> c.getType() == ClaimType.LIQUIDITY_POOL && c.getStatus() != ClaimStatus.FAILED)
                .findFirst();
            NewClaim request = NewClaim.builder()
                .participantId(vault.getOwnerId())
                .vaultId(vaultId)
                .type(ClaimType.LIQUIDITY_POOL)
                .tokenAmount(lp.getAdjustedTokenAmount())
                .currencyAmount(lp.currencyUnits())
                .metadata(LiquidityPoolClaimMetadata.builder()
                    .fullyDilutedValuation(lp.getFullyDilutedValuation())
                    .tokenPrice(lp.getTokenPrice())
                    .pairMultiplier(lp.getPairMultiplier())
                    .unadjustedTokenAmount(lp.getTokenAmount())
                    .currencyAmount(lp.getCurrencyAmount())
                    .build())
                .build();
            upsert(existingLp, request, tally);
        }

        publishCreated(vaultId, tally.created);
        log.info("Materialized claims for vault {}: created={}, kept={}, replaced={}, unallocatedTokens={}",
            vaultId, tally.created.size(), tally.kept, tally.replaced, plan.unallocatedTokens());
        return new MaterializationResult(vaultId, plan, tally.created, tally.kept, tally.replaced);
    }

    private void upsert(Optional<Claim> existing, NewClaim request, Tally tally) {
        if (existing.isPresent()) {
            Claim claim = existing.get();
            boolean sameAmounts = claim.getTokenAmount() == request.getTokenAmount()
                && claim.getCurrencyAmount() == request.getCurrencyAmount();
            if (sameAmounts || claim.getStatus() != ClaimStatus.AVAILABLE) {
                if (!sameAmounts) {
                    log.warn("Claim {} in {} status differs from recomputed amounts and is left unchanged",
                        claim.getId(), claim.getStatus());
                }
                tally.kept++;
                return;
            }
            ledger.removeObsolete(claim.getId());
            tally.replaced++;
        }
        tally.created.add(ledger.createClaim(request));
    }

    private Map<UUID, Claim> existingByTransaction(UUID vaultId, ClaimType type) {
        return ledger.getVaultClaims(vaultId).stream()
            .filter(c -> c.getType() == type)
            .filter(c -> c.getStatus() != ClaimStatus.FAILED)
            .filter(c -> c.getSourceTransactionId() != null)
            .collect(Collectors.toMap(Claim::getSourceTransactionId, Function.identity(), (a, b) -> a));
    }

    private void publishCreated(UUID vaultId, List<Claim> created) {
        if (created.isEmpty()) {
            return;
        }
        long tokens = created.stream().mapToLong(Claim::getTokenAmount).sum();
        long currency = created.stream().mapToLong(Claim::getCurrencyAmount).sum();
        outboxService.saveEvent(ClaimsCreatedEvent.of(
            vaultId, created.stream().map(Claim::getId).toList(), tokens, currency));
    }

    private static final class Tally {
        private final List<Claim> created = new ArrayList<>();
        private int kept;
        private int replaced;
    }

    /**
     * Outcome of one materialization run. plan is null for cancellation runs.
     */
    @Value
    public static class MaterializationResult {
        UUID vaultId;
        DistributionPlan plan;
        List<Claim> created;
        int kept;
        int replaced;
    }
}
