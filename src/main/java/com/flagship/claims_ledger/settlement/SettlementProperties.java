package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Settings for the settlement sweep, bound from {@code settlement.*}.
 */
@ConfigurationProperties(prefix = "settlement")
@Getter
@Setter
public class SettlementProperties {

    /**
     * Enables the scheduled sweep. Manual settlement works either way.
     */
    private boolean enabled = false;

    private long sweepIntervalMs = 60_000;

    /**
     * Byte budget of one settlement transaction imposed by the external ledger.
     */
    private int maxTransactionBytes = 15_900;

    private int maxClaimsPerSweep = 100;

    private int maxBatchClaims = 8;

    private int maxAttempts = 3;

    private Duration initialBackoff = Duration.ofSeconds(2);

    private Duration maxBackoff = Duration.ofSeconds(30);

    /**
     * Fraction of the backoff delay randomized in both directions.
     */
    private double jitterFactor = 0.3;

    private Duration externalCallTimeout = Duration.ofSeconds(60);

    /**
     * PENDING claims untouched for longer than this are reconciled against the external ledger.
     */
    private Duration pendingTimeout = Duration.ofMinutes(30);

    private int vaultParallelism = 4;

    /**
     * Threads for build, submit and output lookups. A call the full pool and queue cannot take fails as transport.
     */
    private int callPoolSize = 8;

    private int callQueueCapacity = 16;

    private Set<ClaimType> eligibleTypes = EnumSet.of(
        ClaimType.ACQUIRER, ClaimType.CONTRIBUTOR, ClaimType.CANCELLATION, ClaimType.TERMINATION);

    private Lease lease = new Lease();

    private Endpoint transactionBuilder = new Endpoint();

    private Endpoint ledger = new Endpoint();

    /**
     * Longest one batch can hold the lease: build and submit each use every
     * attempt up to the call timeout, with the largest jittered backoff between attempts.
     */
    public Duration worstCaseBatchDuration() {
        double jitter = Math.max(0, Math.min(1, jitterFactor));
        Duration perOperation = externalCallTimeout.multipliedBy(maxAttempts);
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            double base = Math.min(initialBackoff.toMillis() * Math.pow(2, attempt - 1), maxBackoff.toMillis());
            perOperation = perOperation.plusMillis(Math.round(base * (1 + jitter)));
        }
        return perOperation.multipliedBy(2);
    }

    /**
     * @throws IllegalStateException if the lease could expire while a batch is still in flight
     */
    public void checkLeaseCoversBatch() {
        Duration worstCase = worstCaseBatchDuration();
        if (lease.getTtl().compareTo(worstCase) <= 0) {
            throw new IllegalStateException(String.format(
                "settlement.lease.ttl (%s) must exceed the worst-case batch duration (%s); "
                    + "raise the TTL or lower external-call-timeout, max-attempts or max-backoff",
                lease.getTtl(), worstCase));
        }
    }

    @Getter
    @Setter
    public static class Lease {
        private String name = "claims-settlement";
        /**
         * Renewed before every batch; must outlast {@link #worstCaseBatchDuration()}.
         */
        private Duration ttl = Duration.ofMinutes(10);
        /**
         * redis or jdbc.
         */
        private String store = "redis";
    }

    @Getter
    @Setter
    public static class Endpoint {
        private String baseUrl = "http://localhost:8090";
    }
}
