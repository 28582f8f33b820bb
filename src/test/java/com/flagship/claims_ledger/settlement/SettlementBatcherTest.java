package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.ClaimStatus;
import com.flagship.claims_ledger.claims.ClaimType;
import com.flagship.claims_ledger.claims.metadata.AcquirerClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.CancellationClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.ClaimMetadata;
import com.flagship.claims_ledger.claims.metadata.RefundAsset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SettlementBatcherTest {

    private static Claim claim(ClaimType type, ClaimMetadata metadata) {
        return Claim.builder()
            .id(UUID.randomUUID())
            .participantId(UUID.randomUUID())
            .vaultId(UUID.randomUUID())
            .type(type)
            .status(ClaimStatus.AVAILABLE)
            .metadata(metadata)
            .build();
    }

    private static Claim acquirer() {
        return claim(ClaimType.ACQUIRER, AcquirerClaimMetadata.builder().build());
    }

    private static Claim refundWithAssets(int assetCount) {
        List<RefundAsset> assets = IntStream.range(0, assetCount)
            .mapToObj(i -> RefundAsset.builder().id(UUID.randomUUID()).assetName("asset-" + i).quantity(1).build())
            .toList();
        return claim(ClaimType.CANCELLATION, CancellationClaimMetadata.builder().assets(assets).build());
    }

    @Test
    @DisplayName("Batches are capped by claim count")
    void testPartition_ClaimCountCap() {
        SettlementBatcher batcher = new SettlementBatcher(1_000_000, 8);
        List<Claim> claims = IntStream.range(0, 20).mapToObj(i -> acquirer()).toList();

        List<List<Claim>> batches = batcher.partition(claims);

        assertEquals(3, batches.size());
        assertEquals(8, batches.get(0).size());
        assertEquals(8, batches.get(1).size());
        assertEquals(4, batches.get(2).size());
        assertEquals(claims.get(8), batches.get(1).get(0), "input order is preserved");
    }

    @Test
    @DisplayName("Batches are capped by estimated bytes")
    void testPartition_ByteCap() {
        // 2000 base + 1500 per payout: 15900 fits nine payouts
        SettlementBatcher batcher = new SettlementBatcher(15_900, 100);
        List<Claim> claims = IntStream.range(0, 12).mapToObj(i -> acquirer()).toList();

        List<List<Claim>> batches = batcher.partition(claims);

        assertEquals(2, batches.size());
        assertEquals(9, batches.get(0).size());
        assertTrue(batcher.estimateBytes(batches.get(0)) <= 15_900);
    }

    @Test
    @DisplayName("Refund assets add to the estimate")
    void testEstimateClaimBytes_RefundAssets() {
        assertEquals(SettlementBatcher.BYTES_PER_PAYOUT, SettlementBatcher.estimateClaimBytes(acquirer()));
        assertEquals(SettlementBatcher.BYTES_PER_PAYOUT + 10 * SettlementBatcher.BYTES_PER_REFUND_ASSET,
            SettlementBatcher.estimateClaimBytes(refundWithAssets(10)));
    }

    @Test
    @DisplayName("A claim larger than the budget is still batched alone")
    void testPartition_OversizeClaimAlone() {
        SettlementBatcher batcher = new SettlementBatcher(5_000, 8);
        Claim big = refundWithAssets(100);
        Claim small = acquirer();

        List<List<Claim>> batches = batcher.partition(List.of(small, big, acquirer()));

        assertEquals(3, batches.size());
        assertEquals(List.of(small), batches.get(0));
        assertEquals(List.of(big), batches.get(1));
    }

    @Test
    @DisplayName("No claims, no batches")
    void testPartition_Empty() {
        assertTrue(new SettlementBatcher(15_900, 8).partition(List.of()).isEmpty());
    }
}
