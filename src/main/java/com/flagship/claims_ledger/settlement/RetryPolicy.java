package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.exception.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Retries {@link TransportException} with exponential backoff and jitter.
 * Any other exception is rethrown immediately.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double jitterFactor;
    private final Random random;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff,
                       double jitterFactor, Random random, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.jitterFactor = Math.max(0, Math.min(1, jitterFactor));
        this.random = random;
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(SettlementProperties properties) {
        return new RetryPolicy(properties.getMaxAttempts(), properties.getInitialBackoff(),
            properties.getMaxBackoff(), properties.getJitterFactor(), new Random(), Sleeper.threadSleep());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @throws TransportException the last failure once every attempt is used
     */
    public <T> T execute(String operation, Supplier<T> action) {
        TransportException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (TransportException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = backoff(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                    operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                sleeper.sleep(delay);
            }
        }
        log.error("{} failed after {} attempts: {}", operation, maxAttempts, last.getMessage());
        throw last;
    }

    /**
     * Delay before the retry that follows the given attempt (1-based).
     */
    Duration backoff(int attempt) {
        double base = initialBackoff.toMillis() * Math.pow(2, attempt - 1);
        double capped = Math.min(base, maxBackoff.toMillis());
        double jitter = 1 + jitterFactor * (2 * random.nextDouble() - 1);
        return Duration.ofMillis(Math.round(capped * jitter));
    }

    @FunctionalInterface
    public interface Sleeper {

        void sleep(Duration duration);

        static Sleeper threadSleep() {
            return duration -> {
                try {
                    Thread.sleep(duration.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransportException("Interrupted while backing off", e);
                }
            };
        }
    }
}
