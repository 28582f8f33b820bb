package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.ClaimStatus;
import com.flagship.claims_ledger.claims.ClaimsLedger;
import com.flagship.claims_ledger.exception.InsufficientBackingException;
import com.flagship.claims_ledger.exception.SettlementBusyException;
import com.flagship.claims_ledger.exception.SizeLimitExceededException;
import com.flagship.claims_ledger.exception.TransportException;
import com.flagship.claims_ledger.exception.ValidationException;
import com.flagship.claims_ledger.observability.ClaimsMetrics;
import com.flagship.claims_ledger.observability.CorrelationContext;
import com.flagship.claims_ledger.vault.Vault;
import com.flagship.claims_ledger.vault.VaultReadService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Pays out AVAILABLE claims through the external transaction builder.
 *
 * One settlement transaction pays a whole batch: its claims move to PENDING
 * together before submit and to CLAIMED or FAILED together afterwards.
 * Only one settlement (sweep or manual) runs cluster-wide, guarded by
 * {@link SettlementLease}. The lease is renewed before every batch, and a
 * vault stops at the first renewal that finds it lost.
 *
 * Claims whose backing cannot be found, or that alone exceed the transaction
 * byte budget, stay AVAILABLE and are counted for an operator.
 *
 * Not transactional itself: every ledger call commits on its own so that
 * PENDING is durable before the external submit.
 */
@Slf4j
public class BatchSettlementProcessor {

    private final ClaimsLedger ledger;
    private final VaultReadService vaultReadService;
    private final BackingValidator backingValidator;
    private final SettlementTransactionBuilder transactionBuilder;
    private final SettlementLease lease;
    private final SettlementBatcher batcher;
    private final RetryPolicy retryPolicy;
    private final ExternalCallExecutor externalCalls;
    private final Executor vaultExecutor;
    private final SettlementProperties properties;
    private final ClaimsMetrics metrics;
    private final Clock clock;

    public BatchSettlementProcessor(ClaimsLedger ledger,
                                    VaultReadService vaultReadService,
                                    BackingValidator backingValidator,
                                    SettlementTransactionBuilder transactionBuilder,
                                    SettlementLease lease,
                                    SettlementBatcher batcher,
                                    RetryPolicy retryPolicy,
                                    ExternalCallExecutor externalCalls,
                                    Executor vaultExecutor,
                                    SettlementProperties properties,
                                    ClaimsMetrics metrics,
                                    Clock clock) {
        this.ledger = ledger;
        this.vaultReadService = vaultReadService;
        this.backingValidator = backingValidator;
        this.transactionBuilder = transactionBuilder;
        this.lease = lease;
        this.batcher = batcher;
        this.retryPolicy = retryPolicy;
        this.externalCalls = externalCalls;
        this.vaultExecutor = vaultExecutor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * One pass over the settlement backlog. Skipped when another holder has the lease.
     * A vault that fails is logged and does not stop the other vaults.
     */
    public SweepReport runSweep(Instant now) {
        String sweepId = CorrelationContext.begin(null);
        try {
            Optional<LeaseHandle> handle = lease.tryAcquire(properties.getLease().getName(),
                properties.getLease().getTtl());
            if (handle.isEmpty()) {
                metrics.recordSweepSkipped();
                log.info("Settlement sweep skipped: lease {} is held elsewhere", properties.getLease().getName());
                return SweepReport.skipped(sweepId, now);
            }

            try {
                return sweep(sweepId, now, handle.get());
            } finally {
                lease.release(handle.get());
            }
        } finally {
            CorrelationContext.clear();
        }
    }

    /**
     * Settles exactly the given claims as one batch.
     *
     * @return the settlement reference
     * @throws com.flagship.claims_ledger.exception.NotFoundException if any claim does not exist
     * @throws ValidationException            if a claim is not AVAILABLE or the claims span vaults
     * @throws SettlementBusyException        if a sweep or another settlement holds the lease
     * @throws InsufficientBackingException   if a claim's backing output is gone
     * @throws SizeLimitExceededException     if the batch does not fit one transaction
     * @throws TransportException             if build or submit keeps failing
     */
    public String settle(Collection<UUID> claimIds) {
        if (claimIds == null || claimIds.isEmpty()) {
            throw new ValidationException("At least one claim id is required");
        }
        checkManualBatch(ledger.getClaims(claimIds));

        LeaseHandle handle = lease.tryAcquire(properties.getLease().getName(), properties.getLease().getTtl())
            .orElseThrow(() -> new SettlementBusyException("Another settlement is in progress"));
        try {
            List<Claim> claims = ledger.getClaims(claimIds);
            UUID vaultId = checkManualBatch(claims);
            MDC.put(CorrelationContext.VAULT_ID_MDC_KEY, vaultId.toString());
            Instant now = clock.instant();

            BackingValidator.BackingCheck check = backingValidator.validate(claims);
            if (!check.getMissing().isEmpty()) {
                throw new InsufficientBackingException("Backing output not found for claims "
                    + check.getMissing().stream().map(Claim::getId).toList());
            }
            check.getConsumed().forEach(this::recover);
            if (check.getBacked().isEmpty()) {
                return check.getConsumed().values().iterator().next();
            }

            Vault vault = vaultReadService.getVault(vaultId);
            List<Claim> batch = check.getBacked();
            keepLease(handle);
            RawTransaction transaction = buildChecked(vault, batch);
            return submitAndComplete(batch, transaction, now);
        } finally {
            MDC.remove(CorrelationContext.VAULT_ID_MDC_KEY);
            lease.release(handle);
        }
    }

    private SweepReport sweep(String sweepId, Instant now, LeaseHandle handle) {
        int reconciled = reconcileStalePending(now);

        List<Claim> candidates = ledger.findSettlementCandidates(properties.getEligibleTypes(),
            properties.getMaxClaimsPerSweep());
        Map<UUID, List<Claim>> byVault = candidates.stream()
            .collect(Collectors.groupingBy(Claim::getVaultId, LinkedHashMap::new, Collectors.toList()));
        log.info("Settlement sweep started: {} claims across {} vaults", candidates.size(), byVault.size());

        List<CompletableFuture<VaultOutcome>> futures = byVault.entrySet().stream()
            .map(entry -> CompletableFuture.supplyAsync(
                () -> processVaultInContext(sweepId, entry.getKey(), entry.getValue(), now, handle), vaultExecutor))
            .toList();

        SweepReport.SweepReportBuilder report = SweepReport.builder()
            .sweepId(sweepId)
            .startedAt(now)
            .stalePendingReconciled(reconciled);
        int processed = 0;
        int failedVaults = 0;
        int batches = 0;
        int settled = 0;
        int recovered = 0;
        int failed = 0;
        int unbacked = 0;
        int oversize = 0;
        for (CompletableFuture<VaultOutcome> future : futures) {
            VaultOutcome outcome = future.join();
            processed++;
            if (outcome.vaultFailed) {
                failedVaults++;
            }
            batches += outcome.batches;
            settled += outcome.settled;
            recovered += outcome.recovered;
            failed += outcome.failed;
            unbacked += outcome.unbacked;
            oversize += outcome.oversize;
            report.settlementReferences(outcome.references);
        }

        SweepReport result = report
            .vaultsProcessed(processed)
            .vaultsFailed(failedVaults)
            .batchesSubmitted(batches)
            .claimsSettled(settled)
            .claimsRecovered(recovered)
            .claimsFailed(failed)
            .claimsUnbacked(unbacked)
            .claimsOversize(oversize)
            .build();
        log.info("Settlement sweep finished: vaults={}, batches={}, settled={}, recovered={}, failed={}, "
                + "unbacked={}, oversize={}",
            processed, batches, settled, recovered, failed, unbacked, oversize);
        return result;
    }

    /**
     * PENDING claims that outlived the timeout are CLAIMED if their backing was spent;
     * the rest are left for an operator.
     */
    private int reconcileStalePending(Instant now) {
        List<Claim> stale = ledger.findStalePending(now.minus(properties.getPendingTimeout()));
        if (stale.isEmpty()) {
            return 0;
        }
        try {
            BackingValidator.BackingCheck check = backingValidator.validate(stale);
            check.getConsumed().forEach(this::recover);
            int unresolved = check.getBacked().size() + check.getMissing().size();
            if (unresolved > 0) {
                log.warn("{} stale PENDING claims could not be reconciled: {}", unresolved,
                    concat(check.getBacked(), check.getMissing()).stream().map(Claim::getId).toList());
            }
            return check.getConsumed().size();
        } catch (TransportException e) {
            log.warn("Stale PENDING reconciliation skipped: {}", e.getMessage());
            return 0;
        }
    }

    private VaultOutcome processVaultInContext(String sweepId, UUID vaultId, List<Claim> claims, Instant now,
                                               LeaseHandle handle) {
        CorrelationContext.begin(sweepId);
        MDC.put(CorrelationContext.VAULT_ID_MDC_KEY, vaultId.toString());
        VaultOutcome outcome = new VaultOutcome();
        try {
            processVault(vaultId, claims, now, handle, outcome);
        } catch (Exception e) {
            outcome.vaultFailed = true;
            log.error("Settlement of vault {} aborted: {}", vaultId, e.getMessage(), e);
        } finally {
            CorrelationContext.clear();
        }
        return outcome;
    }

    private void recover(Claim claim, String consumedBy) {
        MDC.put(CorrelationContext.CLAIM_ID_MDC_KEY, claim.getId().toString());
        try {
            ledger.recoverAsClaimed(claim.getId(), consumedBy);
        } finally {
            MDC.remove(CorrelationContext.CLAIM_ID_MDC_KEY);
        }
    }

    private void processVault(UUID vaultId, List<Claim> claims, Instant now, LeaseHandle handle,
                              VaultOutcome outcome) {
        keepLease(handle);
        BackingValidator.BackingCheck check = backingValidator.validate(claims);

        check.getConsumed().forEach((claim, consumedBy) -> {
            recover(claim, consumedBy);
            outcome.recovered++;
        });
        if (!check.getMissing().isEmpty()) {
            check.getMissing().forEach(claim -> metrics.recordUnbacked(claim.getType()));
            outcome.unbacked += check.getMissing().size();
            log.warn("Insufficient backing, leaving {} claims AVAILABLE for the next sweep: {}",
                check.getMissing().size(), check.getMissing().stream().map(Claim::getId).toList());
        }
        if (check.getBacked().isEmpty()) {
            return;
        }

        Vault vault = vaultReadService.getVault(vaultId);
        for (List<Claim> batch : batcher.partition(check.getBacked())) {
            keepLease(handle);
            settleBatch(vault, batch, now, outcome);
        }
    }

    /**
     * @throws SettlementBusyException if the lease expired or was taken over
     */
    private void keepLease(LeaseHandle handle) {
        if (!lease.renew(handle, properties.getLease().getTtl())) {
            throw new SettlementBusyException("Lease " + handle.getName() + " was lost; no further batches start");
        }
    }

    private void settleBatch(Vault vault, List<Claim> batch, Instant now, VaultOutcome outcome) {
        List<UUID> ids = batch.stream().map(Claim::getId).toList();
        long start = System.nanoTime();

        RawTransaction transaction;
        try {
            transaction = buildChecked(vault, batch);
        } catch (SizeLimitExceededException e) {
            if (batch.size() == 1) {
                Claim claim = batch.get(0);
                metrics.recordOversize(claim.getType());
                outcome.oversize++;
                log.warn("Claim {} alone exceeds the transaction byte budget, leaving it AVAILABLE: {}",
                    claim.getId(), e.getMessage());
                return;
            }
            int middle = batch.size() / 2;
            log.info("Batch of {} claims too large, splitting", batch.size());
            settleBatch(vault, batch.subList(0, middle), now, outcome);
            settleBatch(vault, batch.subList(middle, batch.size()), now, outcome);
            return;
        } catch (TransportException e) {
            ledger.failAll(ids, failureReason("build", e), retryPolicy.getMaxAttempts(), now);
            metrics.recordBatchDuration(Duration.ofNanos(System.nanoTime() - start), false);
            outcome.failed += ids.size();
            return;
        }

        try {
            String reference = submitAndComplete(batch, transaction, now);
            metrics.recordBatchDuration(Duration.ofNanos(System.nanoTime() - start), true);
            outcome.batches++;
            outcome.settled += ids.size();
            outcome.references.add(reference);
        } catch (TransportException e) {
            metrics.recordBatchDuration(Duration.ofNanos(System.nanoTime() - start), false);
            outcome.failed += ids.size();
        }
    }

    /**
     * @throws SizeLimitExceededException if the builder or the built size rejects the batch
     */
    private RawTransaction buildChecked(Vault vault, List<Claim> batch) {
        SettlementBatchSpec spec = SettlementBatchSpec.builder()
            .vaultId(vault.getId())
            .contractAddress(vault.getContractAddress())
            .payouts(batch.stream()
                .map(claim -> SettlementBatchSpec.Payout.of(claim,
                    backingValidator.sourceReference(claim).orElse(null)))
                .toList())
            .build();

        RawTransaction transaction = retryPolicy.execute("build",
            () -> externalCalls.call("build", () -> transactionBuilder.build(spec)));
        if (transaction.getSizeBytes() > properties.getMaxTransactionBytes()) {
            throw new SizeLimitExceededException(String.format(
                "Transaction of %d claims is %d bytes, limit is %d",
                batch.size(), transaction.getSizeBytes(), properties.getMaxTransactionBytes()));
        }
        return transaction;
    }

    /**
     * PENDING, submit, CLAIMED. A submit that keeps failing fails the whole batch and rethrows.
     * Resubmitting the same raw transaction is safe: the ledger accepts it at most once.
     */
    private String submitAndComplete(List<Claim> batch, RawTransaction transaction, Instant now) {
        List<UUID> ids = batch.stream().map(Claim::getId).toList();
        ledger.markPending(ids, now);

        String reference;
        try {
            reference = retryPolicy.execute("submit",
                () -> externalCalls.call("submit", () -> transactionBuilder.submit(transaction)));
        } catch (TransportException e) {
            ledger.failAll(ids, failureReason("submit", e), retryPolicy.getMaxAttempts(), now);
            throw e;
        }

        ledger.completeSettlement(ids, reference);
        log.info("Settled {} claims in transaction {}", ids.size(), reference);
        return reference;
    }

    private UUID checkManualBatch(List<Claim> claims) {
        Set<UUID> vaults = claims.stream().map(Claim::getVaultId).collect(Collectors.toSet());
        if (vaults.size() != 1) {
            throw new ValidationException("Claims of one settlement must belong to a single vault, found " + vaults);
        }
        List<UUID> notAvailable = claims.stream()
            .filter(claim -> claim.getStatus() != ClaimStatus.AVAILABLE)
            .map(Claim::getId)
            .toList();
        if (!notAvailable.isEmpty()) {
            throw new ValidationException("Claims are not AVAILABLE for settlement: " + notAvailable);
        }
        return vaults.iterator().next();
    }

    private String failureReason(String operation, TransportException e) {
        return String.format("Settlement %s failed after %d attempts: %s",
            operation, retryPolicy.getMaxAttempts(), e.getMessage());
    }

    private static List<Claim> concat(List<Claim> first, List<Claim> second) {
        List<Claim> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static final class VaultOutcome {
        private boolean vaultFailed;
        private int batches;
        private int settled;
        private int recovered;
        private int failed;
        private int unbacked;
        private int oversize;
        private final List<String> references = new ArrayList<>();
    }
}
