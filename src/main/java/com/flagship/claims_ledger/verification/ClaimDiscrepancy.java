package com.flagship.claims_ledger.verification;

import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * One claim (or missing claim) whose amounts disagree with the recomputation.
 * claimId is null for an expected allocation that has no claim;
 * expected amounts are null for a claim that should not exist.
 */
@Value
@Builder
public class ClaimDiscrepancy {
    UUID claimId;
    UUID participantId;
    UUID sourceTransactionId;
    ClaimType type;
    Long actualTokens;
    Long expectedTokens;
    long tokenDifference;
    double percentageDifference;
    Long actualCurrency;
    Long expectedCurrency;
    long currencyDifference;
    Long actualMultiplier;
    Long expectedMultiplier;
    String reason;
}
