package com.flagship.claims_ledger.calculation;

import lombok.Value;

import java.util.UUID;

@Value
public class ContributorAllocation {
    UUID transactionId;
    UUID participantId;
    double assessedValue;
    double participantTotal;
    double proportion;
    double share;
    long tokenAmount;
    long currencyAmount;
}
