package com.flagship.claims_ledger.settlement;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one settlement sweep.
 */
@Value
@Builder
public class SweepReport {
    String sweepId;
    Instant startedAt;
    boolean skipped;
    int vaultsProcessed;
    int vaultsFailed;
    int batchesSubmitted;
    int claimsSettled;
    int claimsRecovered;
    int claimsFailed;
    /** Left AVAILABLE because their backing output could not be found. */
    int claimsUnbacked;
    /** Left AVAILABLE because even alone they exceed the transaction byte budget. */
    int claimsOversize;
    int stalePendingReconciled;
    @Singular
    List<String> settlementReferences;

    public static SweepReport skipped(String sweepId, Instant startedAt) {
        return SweepReport.builder().sweepId(sweepId).startedAt(startedAt).skipped(true).build();
    }
}
