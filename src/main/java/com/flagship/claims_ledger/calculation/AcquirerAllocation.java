package com.flagship.claims_ledger.calculation;

import lombok.Value;

import java.util.UUID;

@Value
public class AcquirerAllocation {
    UUID transactionId;
    UUID participantId;
    double currencySent;
    double percentOfTotal;
    double rawTokens;
    long rawMultiplier;
    /** Vault-wide minimum multiplier applied to every acquirer. */
    long multiplier;
    long tokenAmount;
}
