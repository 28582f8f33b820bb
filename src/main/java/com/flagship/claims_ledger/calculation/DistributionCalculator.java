package com.flagship.claims_ledger.calculation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.flagship.claims_ledger.calculation.Rounding.floor;
import static com.flagship.claims_ledger.calculation.Rounding.floorToUnit;
import static com.flagship.claims_ledger.calculation.Rounding.roundHighPrecision;
import static com.flagship.claims_ledger.calculation.Rounding.roundToScale;
import static com.flagship.claims_ledger.calculation.Rounding.safeDivide;

/**
 * Pro-rata allocation of a vault's token supply and acquired currency.
 *
 * Steps run in a fixed order and each consumes the previous output:
 * valuation, liquidity pool, acquirers, contributors. The calculator holds
 * no state, so the reconciliation engine can replay it with historical totals
 * and expect bit-identical results.
 *
 * Arithmetic order inside each formula is significant for floating-point parity.
 */
@Component
@Slf4j
public class DistributionCalculator {

    /** Display unit to smallest unit of the native currency. */
    public static final double UNIT_SCALE = 1_000_000;

    private static final double MAX_SAFE_INTEGER = 9_007_199_254_740_991d;
    private static final int MAX_DECIMALS = 8;
    private static final int MIN_DECIMALS = 1;
    private static final double ASSUMED_MAX_ASSET_QUANTITY = 1000;

    /**
     * Runs every allocation step for one vault.
     */
    public DistributionPlan calculate(DistributionParameters parameters,
                                      List<AcquirerInput> acquirers,
                                      List<ContributorInput> contributors) {
        LiquidityPoolAllocation liquidityPool = calculateLiquidityPool(parameters);
        List<AcquirerAllocation> acquirerAllocations =
                calculateAcquirerAllocations(parameters, liquidityPool, acquirers);
        List<ContributorAllocation> contributorAllocations =
                calculateContributorAllocations(parameters, liquidityPool, contributors);

        DistributionPlan plan = new DistributionPlan(
                parameters, liquidityPool, acquirerAllocations, contributorAllocations);

        log.debug("Calculated distribution: acquirers={}, contributors={}, lpTokens={}, unallocated={}",
                acquirerAllocations.size(), contributorAllocations.size(),
                plan.liquidityPoolTokens(), plan.unallocatedTokens());
        return plan;
    }

    /**
     * Fully-diluted valuation and the liquidity-pool pair.
     */
    public LiquidityPoolAllocation calculateLiquidityPool(DistributionParameters parameters) {
        double supply = parameters.getTokenSupply();
        double acquirerShare = parameters.getAcquirerShare();
        double lpShare = parameters.getLiquidityPoolShare();
        double acquired = parameters.getAcquiredCurrency();

        double fdv = acquired > 0 && acquirerShare > 0
                ? roundToScale(acquired / acquirerShare, 2)
                : parameters.getContributedValue();

        if (lpShare == 0 || fdv == 0) {
            return LiquidityPoolAllocation.none(fdv, roundHighPrecision(safeDivide(fdv, supply)));
        }

        double lpCurrency = roundToScale(lpShare * fdv / 2, 6);
        double lpTokens = roundHighPrecision(lpShare * supply / 2);
        double price = lpTokens > 0 ? roundHighPrecision(lpCurrency / lpTokens) : 0;

        long pairMultiplier = 0;
        long adjustedTokens = 0;
        if (acquired > 0 && lpTokens > 0) {
            pairMultiplier = (long) floor(lpTokens / (acquired * UNIT_SCALE));
            adjustedTokens = floorToUnit(pairMultiplier * acquired * UNIT_SCALE);
        }

        return new LiquidityPoolAllocation(fdv, lpCurrency, lpTokens, price, pairMultiplier, adjustedTokens);
    }

    /**
     * Acquirer tokens, normalized so every acquirer pays the same effective price.
     */
    public List<AcquirerAllocation> calculateAcquirerAllocations(DistributionParameters parameters,
                                                                 LiquidityPoolAllocation liquidityPool,
                                                                 List<AcquirerInput> acquirers) {
        double acquired = parameters.getAcquiredCurrency();
        if (acquired <= 0 || acquirers.isEmpty()) {
            return List.of();
        }

        double distributable = parameters.getTokenSupply() - liquidityPool.getTokenAmount();

        List<AcquirerInput> funded = acquirers.stream()
                .filter(a -> a.getCurrencySent() > 0)
                .toList();

        double[] percents = new double[funded.size()];
        double[] raws = new double[funded.size()];
        long[] multipliers = new long[funded.size()];
        long minMultiplier = Long.MAX_VALUE;

        for (int i = 0; i < funded.size(); i++) {
            double sent = funded.get(i).getCurrencySent();
            percents[i] = roundHighPrecision(sent / acquired);
            raws[i] = roundHighPrecision(percents[i] * parameters.getAcquirerShare() * distributable);
            multipliers[i] = (long) floor(raws[i] / sent / UNIT_SCALE);
            minMultiplier = Math.min(minMultiplier, multipliers[i]);
        }

        List<AcquirerAllocation> result = new ArrayList<>(funded.size());
        for (int i = 0; i < funded.size(); i++) {
            AcquirerInput input = funded.get(i);
            long tokens = floorToUnit(minMultiplier * input.getCurrencySent() * UNIT_SCALE);
            result.add(new AcquirerAllocation(
                    input.getTransactionId(),
                    input.getParticipantId(),
                    input.getCurrencySent(),
                    percents[i],
                    raws[i],
                    multipliers[i],
                    minMultiplier,
                    tokens));
        }
        return List.copyOf(result);
    }

    /**
     * Contributor tokens and currency share.
     */
    public List<ContributorAllocation> calculateContributorAllocations(DistributionParameters parameters,
                                                                       LiquidityPoolAllocation liquidityPool,
                                                                       List<ContributorInput> contributors) {
        double acquirerShare = parameters.getAcquirerShare();
        double contributed = parameters.getContributedValue();
        double distributable = parameters.getTokenSupply() - liquidityPool.getTokenAmount();
        double currencyPool = Math.max(0, parameters.getAcquiredCurrency() - liquidityPool.getCurrencyAmount());

        List<ContributorAllocation> result = new ArrayList<>(contributors.size());
        for (ContributorInput input : contributors) {
            if (input.getAssessedValue() <= 0) {
                continue;
            }
            double proportion = input.getParticipantTotal() > 0
                    ? safeDivide(input.getAssessedValue(), input.getParticipantTotal())
                    : 0;
            double share = contributed > 0 ? safeDivide(input.getParticipantTotal(), contributed) : 0;

            long tokens = 0;
            if (acquirerShare < 1) {
                double participantTokens = roundHighPrecision(distributable * (1 - acquirerShare) * share);
                tokens = floorToUnit(floor(participantTokens * proportion));
            }

            double currencyShare = share * currencyPool;
            long currency = floorToUnit(floor(currencyShare * proportion * UNIT_SCALE));

            result.add(new ContributorAllocation(
                    input.getTransactionId(),
                    input.getParticipantId(),
                    input.getAssessedValue(),
                    input.getParticipantTotal(),
                    proportion,
                    share,
                    Math.max(0, tokens),
                    Math.max(0, currency)));
        }
        return List.copyOf(result);
    }

    /**
     * Splits one contributor claim across its assets and converts each share
     * to a per-unit multiplier. Remainders go to the first assets.
     */
    public List<AssetMultiplier> calculateAssetMultipliers(long tokenAmount,
                                                          long currencyAmount,
                                                          List<AssetQuantity> assets) {
        if (assets.isEmpty()) {
            return List.of();
        }
        int count = assets.size();
        long baseTokens = tokenAmount / count;
        long tokenRemainder = tokenAmount - baseTokens * count;
        long baseCurrency = currencyAmount / count;
        long currencyRemainder = currencyAmount - baseCurrency * count;

        List<AssetMultiplier> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            AssetQuantity asset = assets.get(i);
            long quantity = asset.getQuantity() > 0 ? asset.getQuantity() : 1;
            long tokenShare = baseTokens + (i < tokenRemainder ? 1 : 0);
            long currencyShare = baseCurrency + (i < currencyRemainder ? 1 : 0);
            result.add(new AssetMultiplier(
                    asset.getPolicyId(),
                    asset.getAssetName(),
                    quantity,
                    tokenShare / quantity,
                    currencyShare / quantity));
        }
        return List.copyOf(result);
    }

    /**
     * Chooses token decimals so multipliers neither overflow a 53-bit integer
     * nor floor to zero.
     *
     * @param tokenSupply   supply before scaling by decimals
     * @param maxMultiplier largest per-unit multiplier, or 0 when unknown
     * @param minMultiplier smallest per-unit multiplier, or 0 when unknown
     */
    public int calculateOptimalDecimals(double tokenSupply, double maxMultiplier, double minMultiplier) {
        double supply = tokenSupply > 0 ? tokenSupply : 1;
        int maxFromSupply = (int) Math.floor(Math.log10(MAX_SAFE_INTEGER / supply));

        int maxFromMultiplier = 15;
        if (maxMultiplier > 0) {
            maxFromMultiplier = (int) Math.floor(
                    Math.log10(MAX_SAFE_INTEGER / (maxMultiplier * ASSUMED_MAX_ASSET_QUANTITY)));
        }

        int underflowDecimals = 0;
        if (minMultiplier > 0 && minMultiplier < 1) {
            underflowDecimals = (int) Math.ceil(-Math.log10(minMultiplier));
        }

        int target = targetDecimalsForSupply(supply);
        int wanted = target + underflowDecimals;
        int result = Math.min(Math.min(wanted, Math.min(maxFromSupply, maxFromMultiplier)), MAX_DECIMALS);

        if (underflowDecimals > 0 && result < wanted) {
            log.error("Cannot prevent multiplier underflow: need {} decimals, capped at {} (supply={}, minMultiplier={})",
                    wanted, result, tokenSupply, minMultiplier);
        } else if (result < target) {
            log.warn("Token decimals reduced from {} to {} for overflow safety (supply={}, maxMultiplier={})",
                    target, result, tokenSupply, maxMultiplier);
        }
        return Math.max(result, MIN_DECIMALS);
    }

    private int targetDecimalsForSupply(double supply) {
        if (supply >= 90_000_000_000d) {
            return 1;
        } else if (supply >= 9_000_000_000d) {
            return 2;
        } else if (supply >= 900_000_000d) {
            return 3;
        } else if (supply >= 90_000_000d) {
            return 4;
        } else if (supply >= 9_000_000d) {
            return 5;
        }
        return 6;
    }
}
