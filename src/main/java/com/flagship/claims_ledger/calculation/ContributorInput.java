package com.flagship.claims_ledger.calculation;

import lombok.Value;

import java.util.UUID;

/**
 * One confirmed contribution.
 * participantTotal is the assessed value of all contributions by the same participant.
 */
@Value
public class ContributorInput {
    UUID transactionId;
    UUID participantId;
    double assessedValue;
    double participantTotal;
}
