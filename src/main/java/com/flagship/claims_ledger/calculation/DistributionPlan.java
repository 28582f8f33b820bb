package com.flagship.claims_ledger.calculation;

import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Complete allocation for one vault. Immutable and replayable.
 */
@Value
public class DistributionPlan {
    DistributionParameters parameters;
    LiquidityPoolAllocation liquidityPool;
    List<AcquirerAllocation> acquirers;
    List<ContributorAllocation> contributors;

    public long totalAcquirerTokens() {
        return acquirers.stream().mapToLong(AcquirerAllocation::getTokenAmount).sum();
    }

    public long totalContributorTokens() {
        return contributors.stream().mapToLong(ContributorAllocation::getTokenAmount).sum();
    }

    public long totalContributorCurrency() {
        return contributors.stream().mapToLong(ContributorAllocation::getCurrencyAmount).sum();
    }

    public long liquidityPoolTokens() {
        return liquidityPool.isClaimable() ? liquidityPool.getAdjustedTokenAmount() : 0L;
    }

    public long totalAllocatedTokens() {
        return totalAcquirerTokens() + totalContributorTokens() + liquidityPoolTokens();
    }

    /**
     * Supply left unassigned after normalization. Reported, never redistributed.
     */
    public long unallocatedTokens() {
        return Rounding.floorToUnit(parameters.getTokenSupply()) - totalAllocatedTokens();
    }

    public boolean isConserved() {
        return unallocatedTokens() >= 0;
    }

    public Optional<AcquirerAllocation> findAcquirer(UUID transactionId) {
        return acquirers.stream().filter(a -> a.getTransactionId().equals(transactionId)).findFirst();
    }

    public Optional<ContributorAllocation> findContributor(UUID transactionId) {
        return contributors.stream().filter(c -> c.getTransactionId().equals(transactionId)).findFirst();
    }
}
