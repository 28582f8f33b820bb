package com.flagship.claims_ledger.calculation;

import lombok.Value;

import java.util.UUID;

/**
 * One confirmed acquisition, as seen by the calculator.
 */
@Value
public class AcquirerInput {
    UUID transactionId;
    UUID participantId;
    double currencySent;
}
