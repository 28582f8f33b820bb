package com.flagship.claims_ledger.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private DataSource dataSource;
    private HealthController controller;

    @BeforeEach
    void setUp() {
        dataSource = mock(DataSource.class);
        controller = new HealthController(dataSource,
            Clock.fixed(Instant.parse("2026-05-01T09:00:00Z"), ZoneOffset.UTC), true, "jdbc");
    }

    @Test
    @DisplayName("Reachable database reports UP with the settlement settings")
    void testHealth_Up() throws Exception {
        Connection connection = mock(Connection.class);
        when(connection.isValid(anyInt())).thenReturn(true);
        when(dataSource.getConnection()).thenReturn(connection);

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(200, response.getStatusCode().value());
        assertEquals("UP", response.getBody().get("status"));
        assertEquals("ENABLED", response.getBody().get("settlementSweep"));
        assertEquals("jdbc", response.getBody().get("settlementLease"));
        assertEquals("2026-05-01T09:00:00Z", response.getBody().get("timestamp"));
    }

    @Test
    @DisplayName("Unreachable database reports DOWN with 503")
    void testHealth_DatabaseDown() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(503, response.getStatusCode().value());
        assertEquals("DOWN", response.getBody().get("database"));
    }
}
