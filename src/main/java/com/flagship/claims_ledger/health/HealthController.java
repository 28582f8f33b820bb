package com.flagship.claims_ledger.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain health probe for load balancers, outside actuator security.
 *
 * DOWN with 503 when the claims database is unreachable. The settlement
 * settings are reported so an operator can tell a paused sweep from a broken one.
 */
@RestController
@Slf4j
public class HealthController {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final Clock clock;
    private final boolean sweepEnabled;
    private final String leaseStore;

    public HealthController(DataSource dataSource,
                            Clock clock,
                            @Value("${settlement.enabled:false}") boolean sweepEnabled,
                            @Value("${settlement.lease.store:redis}") String leaseStore) {
        this.dataSource = dataSource;
        this.clock = clock;
        this.sweepEnabled = sweepEnabled;
        this.leaseStore = leaseStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = isDatabaseUp();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", databaseUp ? "UP" : "DOWN");
        response.put("service", "vault-claims-ledger");
        response.put("timestamp", clock.instant().toString());
        response.put("database", databaseUp ? "UP" : "DOWN");
        response.put("settlementSweep", sweepEnabled ? "ENABLED" : "DISABLED");
        response.put("settlementLease", leaseStore);

        HttpStatus status = databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }

    private boolean isDatabaseUp() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Claims database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
