package com.flagship.claims_ledger.verification;

import com.flagship.claims_ledger.calculation.AssetMultiplier;
import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only audit of one vault's claims against a fresh recomputation.
 */
@Value
@Builder
public class VerificationReport {
    UUID vaultId;
    Instant verifiedAt;
    Context context;
    Summary summary;
    List<ClaimDiscrepancy> discrepancies;
    List<ParticipantBreakdown> participants;

    public boolean isClean() {
        return summary.getClaimsWithDiscrepancies() == 0 && summary.isConserved();
    }

    /**
     * Inputs and intermediate values of the recomputation.
     */
    @Value
    @Builder
    public static class Context {
        double tokenSupply;
        double acquirerShare;
        double liquidityPoolShare;
        double acquiredCurrency;
        double contributedValue;
        double fullyDilutedValuation;
        double lpTokenAmount;
        double lpCurrencyAmount;
        long adjustedLpTokenAmount;
        long pairMultiplier;
        double tokenPrice;
        Long acquirerMultiplier;
        List<AssetMultiplier> assetMultipliers;
        int recommendedDecimals;
    }

    @Value
    @Builder
    public static class Summary {
        int totalClaims;
        int validClaims;
        int claimsWithDiscrepancies;
        Map<ClaimType, Integer> claimsByType;
        long actualTotalTokens;
        long expectedTotalTokens;
        long tokenDifference;
        long actualTotalCurrency;
        long expectedTotalCurrency;
        long currencyDifference;
        long maxTokenError;
        long maxCurrencyError;
        /** Tokens held by acquirer, contributor and LP claims; must not exceed supply. */
        long allocatedTokens;
        long unallocatedTokens;
        boolean conserved;
    }
}
