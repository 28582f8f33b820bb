package com.flagship.claims_ledger.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease on a row of settlement_leases. An expired row is taken over by the upsert.
 */
@Slf4j
public class JdbcSettlementLease implements SettlementLease {

    private static final String ACQUIRE_SQL = """
        INSERT INTO settlement_leases (name, token, expires_at)
        VALUES (?, ?, ?)
        ON CONFLICT (name) DO UPDATE
            SET token = EXCLUDED.token, expires_at = EXCLUDED.expires_at
            WHERE settlement_leases.expires_at < ?
        """;

    private static final String RENEW_SQL = """
        UPDATE settlement_leases SET expires_at = ?
        WHERE name = ? AND token = ? AND expires_at >= ?
        """;

    private static final String RELEASE_SQL =
        "DELETE FROM settlement_leases WHERE name = ? AND token = ?";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcSettlementLease(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<LeaseHandle> tryAcquire(String name, Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String token = UUID.randomUUID().toString();

        int rows = jdbcTemplate.update(ACQUIRE_SQL,
            name, token, Timestamp.from(expiresAt), Timestamp.from(now));
        if (rows == 1) {
            log.debug("Acquired lease {} until {}", name, expiresAt);
            return Optional.of(new LeaseHandle(name, token, expiresAt));
        }
        log.debug("Lease {} is held elsewhere", name);
        return Optional.empty();
    }

    @Override
    public boolean renew(LeaseHandle handle, Duration ttl) {
        Instant now = clock.instant();
        int rows = jdbcTemplate.update(RENEW_SQL,
            Timestamp.from(now.plus(ttl)), handle.getName(), handle.getToken(), Timestamp.from(now));
        if (rows == 0) {
            log.warn("Lease {} was lost before renewal", handle.getName());
            return false;
        }
        return true;
    }

    @Override
    public void release(LeaseHandle handle) {
        int rows = jdbcTemplate.update(RELEASE_SQL, handle.getName(), handle.getToken());
        if (rows == 0) {
            log.warn("Lease {} had already expired or changed hands before release", handle.getName());
        }
    }
}
