package com.flagship.claims_ledger.calculation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Allocation results are compared exactly: the calculator must reproduce
 * historical claims to the smallest unit.
 */
class DistributionCalculatorTest {

    private DistributionCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new DistributionCalculator();
    }

    private static DistributionParameters params(double supply, double acquirerShare, double lpShare,
                                                 double acquired, double contributed) {
        return DistributionParameters.builder()
            .tokenSupply(supply)
            .acquirerShare(acquirerShare)
            .liquidityPoolShare(lpShare)
            .acquiredCurrency(acquired)
            .contributedValue(contributed)
            .build();
    }

    private static AcquirerInput acquirer(double sent) {
        return new AcquirerInput(UUID.randomUUID(), UUID.randomUUID(), sent);
    }

    private static ContributorInput contributor(UUID participantId, double value, double participantTotal) {
        return new ContributorInput(UUID.randomUUID(), participantId, value, participantTotal);
    }

    @Nested
    @DisplayName("Reference vault: supply 1,000,000, half to acquirers, 10% LP, 100 acquired, 50 contributed")
    class ReferenceScenario {

        private final AcquirerInput acquirer = acquirer(100);
        private final ContributorInput contributor = contributor(UUID.randomUUID(), 50, 50);
        private DistributionPlan plan;

        @BeforeEach
        void calculate() {
            plan = calculator.calculate(params(1_000_000, 0.5, 0.1, 100, 50),
                List.of(acquirer), List.of(contributor));
        }

        @Test
        @DisplayName("Valuation and LP pair follow from acquired currency")
        void testLiquidityPool() {
            LiquidityPoolAllocation lp = plan.getLiquidityPool();
            assertEquals(200.0, lp.getFullyDilutedValuation());
            assertEquals(10.0, lp.getCurrencyAmount());
            assertEquals(50_000.0, lp.getTokenAmount());
            assertEquals(0, lp.getPairMultiplier());
            assertEquals(0, lp.getAdjustedTokenAmount());
            assertEquals(10_000_000L, lp.currencyUnits());
            assertTrue(lp.isClaimable());
        }

        @Test
        @DisplayName("Acquirer multiplier floors to zero at this supply")
        void testAcquirerGetsNoTokens() {
            AcquirerAllocation allocation = plan.findAcquirer(acquirer.getTransactionId()).orElseThrow();
            assertEquals(0, allocation.getMultiplier());
            assertEquals(0, allocation.getTokenAmount());
        }

        @Test
        @DisplayName("Contributor receives the non-acquirer half of the distributable supply and the remaining currency")
        void testContributorAllocation() {
            ContributorAllocation allocation = plan.findContributor(contributor.getTransactionId()).orElseThrow();
            assertEquals(475_000L, allocation.getTokenAmount());
            assertEquals(90_000_000L, allocation.getCurrencyAmount());
            assertEquals(1.0, allocation.getProportion());
            assertEquals(1.0, allocation.getShare());
        }

        @Test
        @DisplayName("Unallocated supply is reported, never negative")
        void testConservation() {
            assertEquals(475_000L, plan.totalAllocatedTokens());
            assertEquals(525_000L, plan.unallocatedTokens());
            assertTrue(plan.isConserved());
        }
    }

    @Test
    @DisplayName("With six token decimals the same vault pays acquirers at multiplier 4750")
    void testReferenceScenario_ScaledSupply() {
        AcquirerInput acquirer = acquirer(100);
        ContributorInput contributor = contributor(UUID.randomUUID(), 50, 50);

        DistributionPlan plan = calculator.calculate(params(1e12, 0.5, 0.1, 100, 50),
            List.of(acquirer), List.of(contributor));

        AcquirerAllocation allocation = plan.getAcquirers().get(0);
        assertEquals(4750, allocation.getMultiplier());
        assertEquals(475_000_000_000L, allocation.getTokenAmount());
        assertEquals(500, plan.getLiquidityPool().getPairMultiplier());
        assertEquals(50_000_000_000L, plan.getLiquidityPool().getAdjustedTokenAmount());
        assertEquals(475_000_000_000L, plan.getContributors().get(0).getTokenAmount());
        assertEquals(0L, plan.unallocatedTokens());
    }

    @Test
    @DisplayName("Every acquirer gets the minimum multiplier times their contribution")
    void testAcquirerFairness() {
        List<AcquirerInput> acquirers = List.of(acquirer(100), acquirer(70), acquirer(81));
        DistributionPlan plan = calculator.calculate(params(1e12, 0.6, 0.05, 251, 1000), acquirers, List.of());

        long min = plan.getAcquirers().stream().mapToLong(AcquirerAllocation::getRawMultiplier).min().orElseThrow();
        assertEquals(2330, min);
        for (AcquirerAllocation allocation : plan.getAcquirers()) {
            assertEquals(min, allocation.getMultiplier());
            assertEquals((long) (min * allocation.getCurrencySent() * DistributionCalculator.UNIT_SCALE),
                allocation.getTokenAmount());
        }
        assertEquals(233_000_000_000L, plan.getAcquirers().get(0).getTokenAmount());
        assertEquals(163_100_000_000L, plan.getAcquirers().get(1).getTokenAmount());
        assertEquals(188_730_000_000L, plan.getAcquirers().get(2).getTokenAmount());
    }

    @Test
    @DisplayName("Mixed vault allocates no more than supply and splits a participant's share by contribution")
    void testMixedVault_ConservationAndProportions() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        List<ContributorInput> contributors = List.of(
            contributor(alice, 400, 600),
            contributor(alice, 200, 600),
            contributor(bob, 400, 400));

        DistributionPlan plan = calculator.calculate(params(1e12, 0.6, 0.05, 251, 1000),
            List.of(acquirer(100), acquirer(70), acquirer(81)), contributors);

        assertEquals(99, plan.getLiquidityPool().getPairMultiplier());
        assertEquals(24_849_000_000L, plan.getLiquidityPool().getAdjustedTokenAmount());
        assertEquals(10_458_250L, plan.getLiquidityPool().currencyUnits());

        List<ContributorAllocation> allocations = plan.getContributors();
        assertEquals(156_000_000_000L, allocations.get(0).getTokenAmount());
        assertEquals(78_000_000_000L, allocations.get(1).getTokenAmount());
        assertEquals(156_000_000_000L, allocations.get(2).getTokenAmount());
        assertEquals(96_216_700L, allocations.get(0).getCurrencyAmount());
        assertEquals(48_108_350L, allocations.get(1).getCurrencyAmount());
        assertEquals(96_216_700L, allocations.get(2).getCurrencyAmount());

        assertEquals(321_000_000L, plan.unallocatedTokens());
        assertTrue(plan.isConserved());
        assertTrue(plan.totalContributorCurrency()
            <= (long) ((251 - plan.getLiquidityPool().getCurrencyAmount()) * DistributionCalculator.UNIT_SCALE));
    }

    @Test
    @DisplayName("Recalculating the same inputs yields identical allocations")
    void testIdempotence() {
        DistributionParameters parameters = params(1e12, 0.6, 0.05, 251, 1000);
        List<AcquirerInput> acquirers = List.of(acquirer(100), acquirer(70), acquirer(81));
        List<ContributorInput> contributors = List.of(contributor(UUID.randomUUID(), 1000, 1000));

        DistributionPlan first = calculator.calculate(parameters, acquirers, contributors);
        DistributionPlan second = calculator.calculate(parameters, acquirers, contributors);

        assertEquals(first, second);
    }

    @Nested
    @DisplayName("Boundaries")
    class Boundaries {

        @Test
        @DisplayName("Acquirer share of 100% gives contributors no tokens")
        void testFullAcquirerShare() {
            DistributionPlan plan = calculator.calculate(params(1e9, 1.0, 0.0, 500, 0),
                List.of(acquirer(200), acquirer(300)), List.of(contributor(UUID.randomUUID(), 10, 10)));

            assertEquals(400_000_000L, plan.getAcquirers().get(0).getTokenAmount());
            assertEquals(600_000_000L, plan.getAcquirers().get(1).getTokenAmount());
            assertEquals(0L, plan.totalContributorTokens());
            assertEquals(0L, plan.unallocatedTokens());
        }

        @Test
        @DisplayName("No acquired currency: valuation falls back to contributed value and acquirers get nothing")
        void testNoAcquisitions() {
            DistributionPlan plan = calculator.calculate(params(1e9, 0.5, 0.1, 0, 300),
                List.of(), List.of(contributor(UUID.randomUUID(), 100, 100), contributor(UUID.randomUUID(), 200, 200)));

            assertEquals(300.0, plan.getLiquidityPool().getFullyDilutedValuation());
            assertEquals(0, plan.getLiquidityPool().getAdjustedTokenAmount());
            assertTrue(plan.getAcquirers().isEmpty());
            assertEquals(158_333_333L, plan.getContributors().get(0).getTokenAmount());
            assertEquals(316_666_666L, plan.getContributors().get(1).getTokenAmount());
            assertEquals(0L, plan.totalContributorCurrency());
        }

        @Test
        @DisplayName("Zero LP share produces no LP allocation and a price from valuation over supply")
        void testNoLiquidityPool() {
            LiquidityPoolAllocation lp = calculator.calculateLiquidityPool(params(1e9, 0.5, 0.0, 100, 200));

            assertEquals(200.0, lp.getFullyDilutedValuation());
            assertEquals(0.0, lp.getTokenAmount());
            assertEquals(2e-7, lp.getTokenPrice());
            assertFalse(lp.isClaimable());
        }

        @Test
        @DisplayName("Zero-amount acquirers and contributors are skipped")
        void testZeroInputsSkipped() {
            DistributionPlan plan = calculator.calculate(params(1e9, 0.5, 0.0, 100, 200),
                List.of(acquirer(0), acquirer(40), acquirer(60)),
                List.of(contributor(UUID.randomUUID(), 0, 0), contributor(UUID.randomUUID(), 200, 200)));

            assertEquals(2, plan.getAcquirers().size());
            assertEquals(200_000_000L, plan.getAcquirers().get(0).getTokenAmount());
            assertEquals(300_000_000L, plan.getAcquirers().get(1).getTokenAmount());
            assertEquals(1, plan.getContributors().size());
            assertEquals(500_000_000L, plan.getContributors().get(0).getTokenAmount());
            assertEquals(100_000_000L, plan.getContributors().get(0).getCurrencyAmount());
        }
    }

    @Nested
    @DisplayName("Per-asset multipliers")
    class AssetMultipliers {

        @Test
        @DisplayName("Remainders go to the first assets and per-unit values floor")
        void testSplitWithRemainder() {
            List<AssetMultiplier> multipliers = calculator.calculateAssetMultipliers(1_000_003, 10,
                List.of(new AssetQuantity("p1", "a", 1), new AssetQuantity("p1", "b", 3), new AssetQuantity("p2", "c", 1)));

            assertEquals(3, multipliers.size());
            assertEquals(333_335L, multipliers.get(0).getTokensPerUnit());
            assertEquals(333_334L / 3, multipliers.get(1).getTokensPerUnit());
            assertEquals(333_334L, multipliers.get(2).getTokensPerUnit());
            assertEquals(4L, multipliers.get(0).getCurrencyPerUnit());
            long reconstructed = multipliers.stream().mapToLong(AssetMultiplier::reconstructedTokens).sum();
            assertTrue(reconstructed <= 1_000_003L);
        }

        @Test
        @DisplayName("No assets yields no multipliers")
        void testEmpty() {
            assertTrue(calculator.calculateAssetMultipliers(100, 100, List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Optimal decimals")
    class OptimalDecimals {

        @Test
        @DisplayName("Smaller supplies get more decimals")
        void testSupplyTiers() {
            assertEquals(6, calculator.calculateOptimalDecimals(1e6, 0, 0));
            assertEquals(4, calculator.calculateOptimalDecimals(5e8, 0, 0));
            assertEquals(1, calculator.calculateOptimalDecimals(1e11, 0, 0));
        }

        @Test
        @DisplayName("Sub-unit multipliers add decimals up to the cap of 8")
        void testUnderflowProtection() {
            assertEquals(6, calculator.calculateOptimalDecimals(2e7, 0, 0.5));
            assertEquals(8, calculator.calculateOptimalDecimals(1e6, 0, 0.001));
        }

        @Test
        @DisplayName("Large multipliers reduce decimals but never below 1")
        void testOverflowProtection() {
            assertEquals(3, calculator.calculateOptimalDecimals(1e6, 1e9, 0));
            assertEquals(1, calculator.calculateOptimalDecimals(1e6, 1e12, 0));
        }
    }
}
