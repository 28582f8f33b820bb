package com.flagship.claims_ledger.verification;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ParticipantBreakdown {
    UUID participantId;
    long totalTokensClaimed;
    long totalTokensExpected;
    long totalCurrencyClaimed;
    long totalCurrencyExpected;
    int contributionCount;
    int acquisitionCount;
    double totalContributed;
    double totalAcquired;
    /** Participant's contributed value as a percentage of the vault total. */
    double valueSharePercent;
    int discrepancyCount;
    long maxTokenDiscrepancy;
    long maxCurrencyDiscrepancy;
    List<UUID> claimIds;
}
