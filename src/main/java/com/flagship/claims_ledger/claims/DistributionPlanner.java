package com.flagship.claims_ledger.claims;

import com.flagship.claims_ledger.calculation.AcquirerAllocation;
import com.flagship.claims_ledger.calculation.AcquirerInput;
import com.flagship.claims_ledger.calculation.AssetMultiplier;
import com.flagship.claims_ledger.calculation.ContributorAllocation;
import com.flagship.claims_ledger.calculation.ContributorInput;
import com.flagship.claims_ledger.calculation.DistributionCalculator;
import com.flagship.claims_ledger.calculation.DistributionParameters;
import com.flagship.claims_ledger.calculation.DistributionPlan;
import com.flagship.claims_ledger.exception.ValidationException;
import com.flagship.claims_ledger.vault.ContributedAsset;
import com.flagship.claims_ledger.vault.SourceTransaction;
import com.flagship.claims_ledger.vault.Vault;
import com.flagship.claims_ledger.vault.VaultTotals;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Turns a vault and its confirmed transactions into calculator inputs.
 * Shared by claim creation and verification so both replay the same plan.
 */
@Component
@RequiredArgsConstructor
public class DistributionPlanner {

    private final DistributionCalculator calculator;

    /**
     * @throws ValidationException if vault shares or totals are out of range
     */
    public DistributionPlan plan(Vault vault, List<SourceTransaction> transactions, VaultTotals totals) {
        DistributionParameters parameters = vault.toParameters(totals.getAcquiredCurrency(), totals.getContributedValue());
        validate(vault, parameters);

        List<AcquirerInput> acquirers = transactions.stream()
            .filter(SourceTransaction::isAcquisition)
            .map(tx -> new AcquirerInput(tx.getId(), tx.getParticipantId(), tx.getCurrencyAmount()))
            .toList();

        List<ContributorInput> contributors = transactions.stream()
            .filter(SourceTransaction::isContribution)
            .map(tx -> new ContributorInput(
                tx.getId(),
                tx.getParticipantId(),
                tx.assessedValue(),
                totals.participantValue(tx.getParticipantId())))
            .toList();

        return calculator.calculate(parameters, acquirers, contributors);
    }

    public DistributionPlan plan(Vault vault, List<SourceTransaction> transactions) {
        return plan(vault, transactions, VaultTotals.fromTransactions(transactions));
    }

    /**
     * Per-unit payouts of every contributor allocation, in plan order.
     */
    public List<AssetMultiplier> assetMultipliers(DistributionPlan plan, List<SourceTransaction> transactions) {
        Map<UUID, SourceTransaction> byId = transactions.stream()
            .collect(Collectors.toMap(SourceTransaction::getId, Function.identity()));
        List<AssetMultiplier> result = new ArrayList<>();
        for (ContributorAllocation allocation : plan.getContributors()) {
            SourceTransaction tx = byId.get(allocation.getTransactionId());
            if (tx == null) {
                continue;
            }
            result.addAll(calculator.calculateAssetMultipliers(
                allocation.getTokenAmount(),
                allocation.getCurrencyAmount(),
                tx.getAssets().stream().map(ContributedAsset::toQuantity).toList()));
        }
        return result;
    }

    /**
     * Decimals that keep the plan's acquirer and per-unit multipliers representable.
     */
    public int recommendedDecimals(Vault vault, DistributionPlan plan, List<AssetMultiplier> assetMultipliers) {
        long[] multipliers = LongStream.concat(
                plan.getAcquirers().stream().mapToLong(AcquirerAllocation::getMultiplier),
                assetMultipliers.stream().mapToLong(AssetMultiplier::getTokensPerUnit))
            .filter(m -> m > 0)
            .toArray();
        long max = LongStream.of(multipliers).max().orElse(0);
        long min = LongStream.of(multipliers).min().orElse(0);
        return calculator.calculateOptimalDecimals(vault.getTokenSupply(), max, min);
    }

    private void validate(Vault vault, DistributionParameters parameters) {
        double a = parameters.getAcquirerShare();
        double p = parameters.getLiquidityPoolShare();
        if (!(a >= 0 && a <= 1)) {
            throw new ValidationException("Vault " + vault.getId() + " acquirer share must be in [0, 1], was " + a);
        }
        if (!(p >= 0 && p < 1)) {
            throw new ValidationException("Vault " + vault.getId() + " liquidity pool share must be in [0, 1), was " + p);
        }
        if (parameters.getTokenSupply() <= 0) {
            throw new ValidationException("Vault " + vault.getId() + " has no token supply");
        }
        if (parameters.getAcquiredCurrency() < 0 || parameters.getContributedValue() < 0) {
            throw new ValidationException("Vault totals must be non-negative");
        }
    }
}
