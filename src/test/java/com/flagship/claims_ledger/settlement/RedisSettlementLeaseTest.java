package com.flagship.claims_ledger.settlement;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisSettlementLeaseTest {

    private static final Instant NOW = Instant.parse("2026-05-01T09:00:00Z");

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private RedisSettlementLease lease;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        lease = new RedisSettlementLease(redisTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Acquiring sets the key only if absent, with the lease TTL")
    void testTryAcquire_Acquired() {
        Duration ttl = Duration.ofMinutes(5);
        when(valueOperations.setIfAbsent(eq("lease:claims-settlement"), anyString(), eq(ttl))).thenReturn(true);

        Optional<LeaseHandle> handle = lease.tryAcquire("claims-settlement", ttl);

        assertTrue(handle.isPresent());
        assertEquals("claims-settlement", handle.get().getName());
        assertEquals(NOW.plus(ttl), handle.get().getExpiresAt());
        assertFalse(handle.get().getToken().isBlank());
    }

    @Test
    @DisplayName("A held key means the lease is busy")
    void testTryAcquire_Busy() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertTrue(lease.tryAcquire("claims-settlement", Duration.ofMinutes(5)).isEmpty());
    }

    @Test
    @DisplayName("Renewal extends the key only for the holder's token")
    @SuppressWarnings("unchecked")
    void testRenew_CompareAndExpire() {
        LeaseHandle handle = new LeaseHandle("claims-settlement", "token-1", NOW.plusSeconds(300));
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(1L);

        assertTrue(lease.renew(handle, Duration.ofMinutes(10)));

        verify(redisTemplate).execute(any(RedisScript.class),
            eq(Collections.singletonList("lease:claims-settlement")), eq("token-1"), eq("600000"));
    }

    @Test
    @DisplayName("Renewal reports a lease that expired or changed hands")
    @SuppressWarnings("unchecked")
    void testRenew_Lost() {
        LeaseHandle handle = new LeaseHandle("claims-settlement", "token-1", NOW.plusSeconds(300));
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(0L);

        assertFalse(lease.renew(handle, Duration.ofMinutes(10)));
    }

    @Test
    @DisplayName("Release deletes the key only for the holder's token")
    @SuppressWarnings("unchecked")
    void testRelease_CompareAndDelete() {
        LeaseHandle handle = new LeaseHandle("claims-settlement", "token-1", NOW.plusSeconds(300));
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(1L);

        lease.release(handle);

        verify(redisTemplate).execute(any(RedisScript.class),
            eq(Collections.singletonList("lease:claims-settlement")), eq("token-1"));
    }
}
