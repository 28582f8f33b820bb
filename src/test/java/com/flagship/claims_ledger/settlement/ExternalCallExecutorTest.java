package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.exception.SizeLimitExceededException;
import com.flagship.claims_ledger.exception.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExternalCallExecutorTest {

    private ThreadPoolTaskExecutor pool;

    @BeforeEach
    void setUp() {
        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(0);
        pool.setThreadNamePrefix("call-test-");
        pool.initialize();
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    @DisplayName("Returns the collaborator's result")
    void testCall_ReturnsResult() {
        ExternalCallExecutor executor = new ExternalCallExecutor(pool, Duration.ofSeconds(5));
        assertEquals("tx-1", executor.call("submit", () -> "tx-1"));
    }

    @Test
    @DisplayName("A call exceeding the deadline becomes a transport failure and its worker is interrupted")
    void testCall_TimeoutInterruptsWorker() throws InterruptedException {
        ExternalCallExecutor executor = new ExternalCallExecutor(pool, Duration.ofMillis(100));
        CountDownLatch never = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        TransportException ex = assertThrows(TransportException.class, () -> executor.call("build", () -> {
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return "late";
        }));

        assertTrue(ex.getMessage().contains("build timed out"));
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "timed-out call should be interrupted");
    }

    @Test
    @DisplayName("A saturated pool refuses the call as a transport failure")
    void testCall_SaturatedPool() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        pool.execute(() -> {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        ExternalCallExecutor executor = new ExternalCallExecutor(pool, Duration.ofSeconds(1));

        try {
            TransportException ex = assertThrows(TransportException.class, () -> executor.call("submit", () -> "tx-1"));
            assertTrue(ex.getMessage().contains("submit rejected"));
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Runtime failures from the collaborator keep their type")
    void testCall_PropagatesRuntimeFailure() {
        ExternalCallExecutor executor = new ExternalCallExecutor(pool, Duration.ofSeconds(5));

        assertThrows(SizeLimitExceededException.class, () -> executor.call("build", () -> {
            throw new SizeLimitExceededException("too big");
        }));
    }
}
