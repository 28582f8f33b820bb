package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.metadata.CancellationClaimMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one vault's claims into batches that should fit a settlement transaction.
 *
 * Sizes are estimates. The built transaction is still checked, and an
 * oversize batch is halved by the processor.
 */
public class SettlementBatcher {

    static final int BASE_TRANSACTION_BYTES = 2_000;
    static final int BYTES_PER_PAYOUT = 1_500;
    static final int BYTES_PER_REFUND_ASSET = 120;

    private final int maxTransactionBytes;
    private final int maxBatchClaims;

    public SettlementBatcher(int maxTransactionBytes, int maxBatchClaims) {
        this.maxTransactionBytes = maxTransactionBytes;
        this.maxBatchClaims = Math.max(1, maxBatchClaims);
    }

    /**
     * Greedy in input order. A claim that alone exceeds the budget still gets its own batch.
     */
    public List<List<Claim>> partition(List<Claim> claims) {
        List<List<Claim>> batches = new ArrayList<>();
        List<Claim> current = new ArrayList<>();
        int currentBytes = BASE_TRANSACTION_BYTES;

        for (Claim claim : claims) {
            int claimBytes = estimateClaimBytes(claim);
            boolean full = current.size() >= maxBatchClaims
                || currentBytes + claimBytes > maxTransactionBytes;
            if (!current.isEmpty() && full) {
                batches.add(current);
                current = new ArrayList<>();
                currentBytes = BASE_TRANSACTION_BYTES;
            }
            current.add(claim);
            currentBytes += claimBytes;
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }

    public int estimateBytes(List<Claim> claims) {
        return BASE_TRANSACTION_BYTES + claims.stream().mapToInt(SettlementBatcher::estimateClaimBytes).sum();
    }

    static int estimateClaimBytes(Claim claim) {
        int bytes = BYTES_PER_PAYOUT;
        if (claim.getMetadata() instanceof CancellationClaimMetadata) {
            bytes += BYTES_PER_REFUND_ASSET * ((CancellationClaimMetadata) claim.getMetadata()).assetCount();
        }
        return bytes;
    }
}
