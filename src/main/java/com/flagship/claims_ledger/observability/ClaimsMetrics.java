package com.flagship.claims_ledger.observability;

import com.flagship.claims_ledger.claims.ClaimRepository;
import com.flagship.claims_ledger.claims.ClaimStatus;
import com.flagship.claims_ledger.claims.ClaimType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the claim lifecycle.
 *
 * - claims.created / claims.settled / claims.failed / claims.recovered (by type)
 * - claims.settlement.batch.duration
 * - claims.settlement.unbacked / claims.settlement.oversize (claims left AVAILABLE for an operator)
 * - claims.verification.discrepancies
 * - claims.backlog (gauge per status)
 */
@Component
@Slf4j
public class ClaimsMetrics {

    private final MeterRegistry registry;
    private final ClaimRepository claimRepository;
    private final Timer batchTimer;
    private final Map<ClaimStatus, AtomicLong> backlog = new EnumMap<>(ClaimStatus.class);

    public ClaimsMetrics(MeterRegistry registry, ClaimRepository claimRepository) {
        this.registry = registry;
        this.claimRepository = claimRepository;

        this.batchTimer = Timer.builder("claims.settlement.batch.duration")
                .description("Time to build and submit one settlement batch")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        for (ClaimStatus status : new ClaimStatus[] {ClaimStatus.AVAILABLE, ClaimStatus.PENDING}) {
            AtomicLong value = new AtomicLong(0);
            backlog.put(status, value);
            Gauge.builder("claims.backlog", value, AtomicLong::get)
                    .description("Claims waiting for settlement")
                    .tag("status", status.name().toLowerCase())
                    .register(registry);
        }
    }

    public void recordCreated(ClaimType type, int count) {
        registry.counter("claims.created", "type", tag(type)).increment(count);
    }

    public void recordSettled(ClaimType type) {
        registry.counter("claims.settled", "type", tag(type)).increment();
    }

    public void recordFailed(ClaimType type, String reason) {
        registry.counter("claims.failed", "type", tag(type), "reason", sanitizeTag(reason)).increment();
    }

    public void recordRecovered(ClaimType type) {
        registry.counter("claims.recovered", "type", tag(type)).increment();
    }

    public void recordBatchDuration(Duration duration, boolean success) {
        batchTimer.record(duration);
        registry.counter("claims.settlement.batches", "result", success ? "success" : "failure").increment();
    }

    public void recordUnbacked(ClaimType type) {
        registry.counter("claims.settlement.unbacked", "type", tag(type)).increment();
    }

    public void recordOversize(ClaimType type) {
        registry.counter("claims.settlement.oversize", "type", tag(type)).increment();
    }

    public void recordSweepSkipped() {
        registry.counter("claims.settlement.sweep.skipped").increment();
    }

    public void recordVerification(int discrepancies) {
        registry.counter("claims.verification.runs").increment();
        registry.counter("claims.verification.discrepancies").increment(discrepancies);
    }

    @Transactional(readOnly = true)
    public void refreshBacklog() {
        try {
            backlog.forEach((status, value) -> value.set(claimRepository.countByStatus(status)));
        } catch (Exception e) {
            log.warn("Failed to refresh claim backlog metrics: {}", e.getMessage());
        }
    }

    private String tag(ClaimType type) {
        return type.name().toLowerCase();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
