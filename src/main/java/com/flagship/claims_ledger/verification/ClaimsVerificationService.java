package com.flagship.claims_ledger.verification;

import com.flagship.claims_ledger.calculation.AcquirerAllocation;
import com.flagship.claims_ledger.calculation.AssetMultiplier;
import com.flagship.claims_ledger.calculation.ContributorAllocation;
import com.flagship.claims_ledger.calculation.DistributionPlan;
import com.flagship.claims_ledger.calculation.LiquidityPoolAllocation;
import com.flagship.claims_ledger.calculation.Rounding;
import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.ClaimStatus;
import com.flagship.claims_ledger.claims.ClaimType;
import com.flagship.claims_ledger.claims.ClaimsLedger;
import com.flagship.claims_ledger.claims.DistributionPlanner;
import com.flagship.claims_ledger.observability.ClaimsMetrics;
import com.flagship.claims_ledger.vault.SourceTransaction;
import com.flagship.claims_ledger.vault.Vault;
import com.flagship.claims_ledger.vault.VaultReadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Recomputes a vault's distribution from its source transactions and diffs it
 * against the recorded claims.
 *
 * Differences of one smallest unit or less are treated as rounding jitter.
 * Never changes claim amounts; {@link #annotate(UUID)} writes diagnostic
 * metadata only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimsVerificationService {

    static final long TOLERANCE = 1;

    private static final Set<ClaimType> DISTRIBUTION_TYPES =
        EnumSet.of(ClaimType.ACQUIRER, ClaimType.CONTRIBUTOR, ClaimType.LIQUIDITY_POOL);

    private final VaultReadService vaultReadService;
    private final DistributionPlanner planner;
    private final ClaimsLedger ledger;
    private final ClaimsMetrics metrics;
    private final Clock clock;

    @Transactional(readOnly = true)
    public VerificationReport verify(UUID vaultId, VerificationFilter filter) {
        VerificationFilter effective = filter != null ? filter : VerificationFilter.none();

        Vault vault = vaultReadService.getVault(vaultId);
        List<SourceTransaction> transactions = vaultReadService.findConfirmedTransactions(vaultId);
        DistributionPlan plan = planner.plan(vault, transactions);

        List<Claim> claims = ledger.getVaultClaims(vaultId).stream()
            .filter(c -> DISTRIBUTION_TYPES.contains(c.getType()))
            .filter(c -> c.getStatus() != ClaimStatus.FAILED)
            .toList();

        List<ClaimDiscrepancy> discrepancies = new ArrayList<>();
        Map<UUID, Expected> expectedByClaim = new HashMap<>();
        diffClaims(plan, claims, discrepancies, expectedByClaim);
        addMissingClaims(plan, claims, discrepancies);

        VerificationReport.Summary summary = summarize(vault, plan, claims, discrepancies, expectedByClaim);
        List<ParticipantBreakdown> participants =
            breakdown(plan, transactions, claims, discrepancies, expectedByClaim);

        metrics.recordVerification(discrepancies.size());
        if (!discrepancies.isEmpty() || !summary.isConserved()) {
            log.warn("Vault {} verification found {} discrepancies (conserved={})",
                vaultId, discrepancies.size(), summary.isConserved());
        } else {
            log.info("Vault {} verification clean: {} claims", vaultId, claims.size());
        }

        List<ClaimDiscrepancy> filteredDiscrepancies = discrepancies.stream()
            .filter(d -> effective.getParticipantId() == null
                || effective.getParticipantId().equals(d.getParticipantId()))
            .toList();
        List<ParticipantBreakdown> filteredParticipants = participants.stream()
            .filter(p -> effective.getParticipantId() == null
                || effective.getParticipantId().equals(p.getParticipantId()))
            .filter(p -> !effective.isDiscrepanciesOnly() || p.getDiscrepancyCount() > 0)
            .toList();

        return VerificationReport.builder()
            .vaultId(vaultId)
            .verifiedAt(clock.instant())
            .context(context(vault, plan, transactions))
            .summary(summary)
            .discrepancies(filteredDiscrepancies)
            .participants(filteredParticipants)
            .build();
    }

    /**
     * Runs {@link #verify} and stamps the result into each claim's metadata.
     * Amounts are left untouched.
     */
    @Transactional
    public VerificationReport annotate(UUID vaultId) {
        VerificationReport report = verify(vaultId, VerificationFilter.none());
        Map<UUID, ClaimDiscrepancy> byClaim = new HashMap<>();
        report.getDiscrepancies().stream()
            .filter(d -> d.getClaimId() != null)
            .forEach(d -> byClaim.put(d.getClaimId(), d));

        for (Claim claim : ledger.getVaultClaims(vaultId)) {
            if (!DISTRIBUTION_TYPES.contains(claim.getType()) || claim.getStatus() == ClaimStatus.FAILED) {
                continue;
            }
            ClaimDiscrepancy discrepancy = byClaim.get(claim.getId());
            Map<String, Object> patch = new HashMap<>();
            patch.put("lastVerifiedAt", report.getVerifiedAt());
            patch.put("verificationTokenDifference", discrepancy != null ? discrepancy.getTokenDifference() : null);
            patch.put("verificationCurrencyDifference",
                discrepancy != null ? discrepancy.getCurrencyDifference() : null);
            ledger.mergeMetadata(claim.getId(), patch);
        }
        return report;
    }

    private void diffClaims(DistributionPlan plan, List<Claim> claims,
                            List<ClaimDiscrepancy> discrepancies, Map<UUID, Expected> expectedByClaim) {
        LiquidityPoolAllocation lp = plan.getLiquidityPool();
        for (Claim claim : claims) {
            Expected expected = switch (claim.getType()) {
                case ACQUIRER -> plan.findAcquirer(claim.getSourceTransactionId())
                    .map(a -> new Expected(a.getTokenAmount(), 0, a.getMultiplier()))
                    .orElse(null);
                case CONTRIBUTOR -> plan.findContributor(claim.getSourceTransactionId())
                    .map(c -> new Expected(c.getTokenAmount(), c.getCurrencyAmount(), null))
                    .orElse(null);
                case LIQUIDITY_POOL -> lp.isClaimable()
                    ? new Expected(lp.getAdjustedTokenAmount(), lp.currencyUnits(), null)
                    : null;
                default -> null;
            };

            if (expected == null) {
                String reason = claim.getType() == ClaimType.LIQUIDITY_POOL
                    ? "Liquidity pool claim exists but the recomputation has no liquidity pool"
                    : "No corresponding transaction found for recalculation";
                discrepancies.add(ClaimDiscrepancy.builder()
                    .claimId(claim.getId())
                    .participantId(claim.getParticipantId())
                    .sourceTransactionId(claim.getSourceTransactionId())
                    .type(claim.getType())
                    .actualTokens(claim.getTokenAmount())
                    .tokenDifference(claim.getTokenAmount())
                    .actualCurrency(claim.getCurrencyAmount())
                    .currencyDifference(claim.getCurrencyAmount())
                    .actualMultiplier(claim.getMultiplier())
                    .reason(reason)
                    .build());
                continue;
            }

            expectedByClaim.put(claim.getId(), expected);
            long tokenDiff = claim.getTokenAmount() - expected.tokens;
            long currencyDiff = claim.getCurrencyAmount() - expected.currency;
            if (Math.abs(tokenDiff) > TOLERANCE || Math.abs(currencyDiff) > TOLERANCE) {
                discrepancies.add(ClaimDiscrepancy.builder()
                    .claimId(claim.getId())
                    .participantId(claim.getParticipantId())
                    .sourceTransactionId(claim.getSourceTransactionId())
                    .type(claim.getType())
                    .actualTokens(claim.getTokenAmount())
                    .expectedTokens(expected.tokens)
                    .tokenDifference(tokenDiff)
                    .percentageDifference(percentage(tokenDiff, expected.tokens))
                    .actualCurrency(claim.getCurrencyAmount())
                    .expectedCurrency(expected.currency)
                    .currencyDifference(currencyDiff)
                    .actualMultiplier(claim.getMultiplier())
                    .expectedMultiplier(expected.multiplier)
                    .reason(String.format("Stored amounts differ from recomputation: tokens %+d, currency %+d",
                        tokenDiff, currencyDiff))
                    .build());
            }
        }
    }

    private void addMissingClaims(DistributionPlan plan, List<Claim> claims, List<ClaimDiscrepancy> discrepancies) {
        Set<UUID> claimedTransactions = new HashSet<>();
        boolean hasLpClaim = false;
        for (Claim claim : claims) {
            if (claim.getSourceTransactionId() != null) {
                claimedTransactions.add(claim.getSourceTransactionId());
            }
            hasLpClaim |= claim.getType() == ClaimType.LIQUIDITY_POOL;
        }

        for (AcquirerAllocation a : plan.getAcquirers()) {
            if (!claimedTransactions.contains(a.getTransactionId())) {
                discrepancies.add(missing(a.getParticipantId(), a.getTransactionId(), ClaimType.ACQUIRER,
                    a.getTokenAmount(), 0, a.getMultiplier()));
            }
        }
        for (ContributorAllocation c : plan.getContributors()) {
            if (!claimedTransactions.contains(c.getTransactionId())) {
                discrepancies.add(missing(c.getParticipantId(), c.getTransactionId(), ClaimType.CONTRIBUTOR,
                    c.getTokenAmount(), c.getCurrencyAmount(), null));
            }
        }
        LiquidityPoolAllocation lp = plan.getLiquidityPool();
        if (lp.isClaimable() && !hasLpClaim) {
            discrepancies.add(missing(null, null, ClaimType.LIQUIDITY_POOL,
                lp.getAdjustedTokenAmount(), lp.currencyUnits(), null));
        }
    }

    private ClaimDiscrepancy missing(UUID participantId, UUID transactionId, ClaimType type,
                                     long tokens, long currency, Long multiplier) {
        return ClaimDiscrepancy.builder()
            .participantId(participantId)
            .sourceTransactionId(transactionId)
            .type(type)
            .expectedTokens(tokens)
            .tokenDifference(-tokens)
            .percentageDifference(tokens > 0 ? -100.0 : 0.0)
            .expectedCurrency(currency)
            .currencyDifference(-currency)
            .expectedMultiplier(multiplier)
            .reason("No claim recorded for expected allocation")
            .build();
    }

    private VerificationReport.Summary summarize(Vault vault, DistributionPlan plan, List<Claim> claims,
                                                 List<ClaimDiscrepancy> discrepancies,
                                                 Map<UUID, Expected> expectedByClaim) {
        Map<ClaimType, Integer> byType = new EnumMap<>(ClaimType.class);
        claims.forEach(c -> byType.merge(c.getType(), 1, Integer::sum));

        long actualTokens = claims.stream().mapToLong(Claim::getTokenAmount).sum();
        long actualCurrency = claims.stream().mapToLong(Claim::getCurrencyAmount).sum();
        long expectedTokens = plan.totalAllocatedTokens();
        long expectedCurrency = plan.totalContributorCurrency()
            + (plan.getLiquidityPool().isClaimable() ? plan.getLiquidityPool().currencyUnits() : 0);

        long maxTokenError = 0;
        long maxCurrencyError = 0;
        for (Claim claim : claims) {
            Expected expected = expectedByClaim.get(claim.getId());
            if (expected != null) {
                maxTokenError = Math.max(maxTokenError, Math.abs(claim.getTokenAmount() - expected.tokens));
                maxCurrencyError = Math.max(maxCurrencyError, Math.abs(claim.getCurrencyAmount() - expected.currency));
            }
        }

        long supply = Rounding.floorToUnit(vault.scaledTokenSupply());
        long flaggedClaims = discrepancies.stream().filter(d -> d.getClaimId() != null).count();

        return VerificationReport.Summary.builder()
            .totalClaims(claims.size())
            .validClaims((int) (claims.size() - flaggedClaims))
            .claimsWithDiscrepancies(discrepancies.size())
            .claimsByType(byType)
            .actualTotalTokens(actualTokens)
            .expectedTotalTokens(expectedTokens)
            .tokenDifference(actualTokens - expectedTokens)
            .actualTotalCurrency(actualCurrency)
            .expectedTotalCurrency(expectedCurrency)
            .currencyDifference(actualCurrency - expectedCurrency)
            .maxTokenError(maxTokenError)
            .maxCurrencyError(maxCurrencyError)
            .allocatedTokens(actualTokens)
            .unallocatedTokens(supply - actualTokens)
            .conserved(actualTokens <= supply)
            .build();
    }

    private List<ParticipantBreakdown> breakdown(DistributionPlan plan, List<SourceTransaction> transactions,
                                                 List<Claim> claims, List<ClaimDiscrepancy> discrepancies,
                                                 Map<UUID, Expected> expectedByClaim) {
        Map<UUID, ParticipantTally> tallies = new LinkedHashMap<>();

        for (SourceTransaction tx : transactions) {
            ParticipantTally tally = tallies.computeIfAbsent(tx.getParticipantId(), ParticipantTally::new);
            if (tx.isContribution()) {
                tally.contributions++;
                tally.contributed += tx.assessedValue();
            } else {
                tally.acquisitions++;
                tally.acquired += tx.getCurrencyAmount();
            }
        }
        for (AcquirerAllocation a : plan.getAcquirers()) {
            tallies.computeIfAbsent(a.getParticipantId(), ParticipantTally::new).tokensExpected += a.getTokenAmount();
        }
        for (ContributorAllocation c : plan.getContributors()) {
            ParticipantTally tally = tallies.computeIfAbsent(c.getParticipantId(), ParticipantTally::new);
            tally.tokensExpected += c.getTokenAmount();
            tally.currencyExpected += c.getCurrencyAmount();
        }

        for (Claim claim : claims) {
            ParticipantTally tally = tallies.computeIfAbsent(claim.getParticipantId(), ParticipantTally::new);
            tally.tokensClaimed += claim.getTokenAmount();
            tally.currencyClaimed += claim.getCurrencyAmount();
            tally.claimIds.add(claim.getId());
            Expected expected = expectedByClaim.get(claim.getId());
            if (claim.getType() == ClaimType.LIQUIDITY_POOL && expected != null) {
                tally.tokensExpected += expected.tokens;
                tally.currencyExpected += expected.currency;
            }
        }

        for (ClaimDiscrepancy d : discrepancies) {
            if (d.getParticipantId() == null) {
                continue;
            }
            ParticipantTally tally = tallies.computeIfAbsent(d.getParticipantId(), ParticipantTally::new);
            tally.discrepancies++;
            tally.maxTokenDiscrepancy = Math.max(tally.maxTokenDiscrepancy, Math.abs(d.getTokenDifference()));
            tally.maxCurrencyDiscrepancy = Math.max(tally.maxCurrencyDiscrepancy, Math.abs(d.getCurrencyDifference()));
        }

        double contributedTotal = plan.getParameters().getContributedValue();
        return tallies.values().stream()
            .map(t -> ParticipantBreakdown.builder()
                .participantId(t.participantId)
                .totalTokensClaimed(t.tokensClaimed)
                .totalTokensExpected(t.tokensExpected)
                .totalCurrencyClaimed(t.currencyClaimed)
                .totalCurrencyExpected(t.currencyExpected)
                .contributionCount(t.contributions)
                .acquisitionCount(t.acquisitions)
                .totalContributed(t.contributed)
                .totalAcquired(t.acquired)
                .valueSharePercent(contributedTotal > 0 ? t.contributed / contributedTotal * 100 : 0)
                .discrepancyCount(t.discrepancies)
                .maxTokenDiscrepancy(t.maxTokenDiscrepancy)
                .maxCurrencyDiscrepancy(t.maxCurrencyDiscrepancy)
                .claimIds(List.copyOf(t.claimIds))
                .build())
            .sorted(Comparator.comparingLong(ParticipantBreakdown::getTotalTokensClaimed).reversed())
            .toList();
    }

    private VerificationReport.Context context(Vault vault, DistributionPlan plan,
                                               List<SourceTransaction> transactions) {
        LiquidityPoolAllocation lp = plan.getLiquidityPool();
        List<AssetMultiplier> assetMultipliers = planner.assetMultipliers(plan, transactions);
        return VerificationReport.Context.builder()
            .tokenSupply(plan.getParameters().getTokenSupply())
            .acquirerShare(plan.getParameters().getAcquirerShare())
            .liquidityPoolShare(plan.getParameters().getLiquidityPoolShare())
            .acquiredCurrency(plan.getParameters().getAcquiredCurrency())
            .contributedValue(plan.getParameters().getContributedValue())
            .fullyDilutedValuation(lp.getFullyDilutedValuation())
            .lpTokenAmount(lp.getTokenAmount())
            .lpCurrencyAmount(lp.getCurrencyAmount())
            .adjustedLpTokenAmount(lp.getAdjustedTokenAmount())
            .pairMultiplier(lp.getPairMultiplier())
            .tokenPrice(lp.getTokenPrice())
            .acquirerMultiplier(plan.getAcquirers().isEmpty() ? null : plan.getAcquirers().get(0).getMultiplier())
            .assetMultipliers(assetMultipliers)
            .recommendedDecimals(planner.recommendedDecimals(vault, plan, assetMultipliers))
            .build();
    }

    private static double percentage(long difference, long expected) {
        return expected != 0 ? (double) difference / expected * 100 : 0.0;
    }

    private static final class Expected {
        private final long tokens;
        private final long currency;
        private final Long multiplier;

        private Expected(long tokens, long currency, Long multiplier) {
            this.tokens = tokens;
            this.currency = currency;
            this.multiplier = multiplier;
        }
    }

    private static final class ParticipantTally {
        private final UUID participantId;
        private final List<UUID> claimIds = new ArrayList<>();
        private long tokensClaimed;
        private long tokensExpected;
        private long currencyClaimed;
        private long currencyExpected;
        private int contributions;
        private int acquisitions;
        private double contributed;
        private double acquired;
        private int discrepancies;
        private long maxTokenDiscrepancy;
        private long maxCurrencyDiscrepancy;

        private ParticipantTally(UUID participantId) {
            this.participantId = participantId;
        }
    }
}
