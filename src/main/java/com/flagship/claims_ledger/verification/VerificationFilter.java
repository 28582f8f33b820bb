package com.flagship.claims_ledger.verification;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Narrows a verification report. Filtering never changes the summary totals.
 */
@Value
@Builder
public class VerificationFilter {
    UUID participantId;
    boolean discrepanciesOnly;

    public static VerificationFilter none() {
        return VerificationFilter.builder().build();
    }
}
