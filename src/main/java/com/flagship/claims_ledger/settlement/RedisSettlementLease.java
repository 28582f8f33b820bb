package com.flagship.claims_ledger.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease on a Redis key: SET NX PX to acquire, compare-and-PEXPIRE to renew,
 * compare-and-delete to release.
 */
@Slf4j
public class RedisSettlementLease implements SettlementLease {

    static final String KEY_PREFIX = "lease:";

    private static final String RELEASE_SCRIPT =
        "if redis.call('get', KEYS[1]) == ARGV[1] then " +
        "   return redis.call('del', KEYS[1]) " +
        "else " +
        "   return 0 " +
        "end";

    private static final String RENEW_SCRIPT =
        "if redis.call('get', KEYS[1]) == ARGV[1] then " +
        "   return redis.call('pexpire', KEYS[1], ARGV[2]) " +
        "else " +
        "   return 0 " +
        "end";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final DefaultRedisScript<Long> releaseScript;
    private final DefaultRedisScript<Long> renewScript;

    public RedisSettlementLease(StringRedisTemplate redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.releaseScript = new DefaultRedisScript<>();
        this.releaseScript.setScriptText(RELEASE_SCRIPT);
        this.releaseScript.setResultType(Long.class);
        this.renewScript = new DefaultRedisScript<>();
        this.renewScript.setScriptText(RENEW_SCRIPT);
        this.renewScript.setResultType(Long.class);
    }

    @Override
    public Optional<LeaseHandle> tryAcquire(String name, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + name, token, ttl);
        if (Boolean.TRUE.equals(acquired)) {
            log.debug("Acquired lease {} for {}", name, ttl);
            return Optional.of(new LeaseHandle(name, token, clock.instant().plus(ttl)));
        }
        log.debug("Lease {} is held elsewhere", name);
        return Optional.empty();
    }

    @Override
    public boolean renew(LeaseHandle handle, Duration ttl) {
        Long renewed = redisTemplate.execute(
            renewScript,
            Collections.singletonList(KEY_PREFIX + handle.getName()),
            handle.getToken(),
            String.valueOf(ttl.toMillis()));
        if (renewed == null || renewed == 0) {
            log.warn("Lease {} was lost before renewal", handle.getName());
            return false;
        }
        return true;
    }

    @Override
    public void release(LeaseHandle handle) {
        Long deleted = redisTemplate.execute(
            releaseScript,
            Collections.singletonList(KEY_PREFIX + handle.getName()),
            handle.getToken());
        if (deleted == null || deleted == 0) {
            log.warn("Lease {} had already expired or changed hands before release", handle.getName());
        }
    }
}
