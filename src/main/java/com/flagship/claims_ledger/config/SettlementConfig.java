package com.flagship.claims_ledger.config;

import com.flagship.claims_ledger.claims.ClaimsLedger;
import com.flagship.claims_ledger.observability.ClaimsMetrics;
import com.flagship.claims_ledger.settlement.BackingValidator;
import com.flagship.claims_ledger.settlement.BatchSettlementProcessor;
import com.flagship.claims_ledger.settlement.ExternalCallExecutor;
import com.flagship.claims_ledger.settlement.ExternalLedgerClient;
import com.flagship.claims_ledger.settlement.HttpExternalLedgerClient;
import com.flagship.claims_ledger.settlement.HttpSettlementTransactionBuilder;
import com.flagship.claims_ledger.settlement.JdbcSettlementLease;
import com.flagship.claims_ledger.settlement.RedisSettlementLease;
import com.flagship.claims_ledger.settlement.RetryPolicy;
import com.flagship.claims_ledger.settlement.SettlementBatcher;
import com.flagship.claims_ledger.settlement.SettlementLease;
import com.flagship.claims_ledger.settlement.SettlementProperties;
import com.flagship.claims_ledger.settlement.SettlementTransactionBuilder;
import com.flagship.claims_ledger.vault.VaultReadService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the settlement processor and its collaborators.
 *
 * The lease store is chosen by settlement.lease.store (redis by default).
 * Startup fails when the lease TTL does not outlast one worst-case batch.
 * The HTTP adapters back off when another bean of the same interface is defined.
 */
@Configuration
public class SettlementConfig {

    @Bean
    @ConditionalOnProperty(name = "settlement.lease.store", havingValue = "redis", matchIfMissing = true)
    public SettlementLease redisSettlementLease(StringRedisTemplate redisTemplate, Clock clock) {
        return new RedisSettlementLease(redisTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "settlement.lease.store", havingValue = "jdbc")
    public SettlementLease jdbcSettlementLease(JdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcSettlementLease(jdbcTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExternalLedgerClient externalLedgerClient(RestClient.Builder restClientBuilder,
                                                     SettlementProperties properties) {
        return new HttpExternalLedgerClient(restClientBuilder.clone()
            .baseUrl(properties.getLedger().getBaseUrl())
            .build());
    }

    @Bean
    @ConditionalOnMissingBean
    public SettlementTransactionBuilder settlementTransactionBuilder(RestClient.Builder restClientBuilder,
                                                                     SettlementProperties properties) {
        return new HttpSettlementTransactionBuilder(restClientBuilder.clone()
            .baseUrl(properties.getTransactionBuilder().getBaseUrl())
            .build());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService settlementVaultExecutor(SettlementProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getVaultParallelism()),
            namedThreads("settlement-vault-"));
    }

    /**
     * Bounded pool for external calls. Shutdown interrupts calls still running.
     */
    @Bean
    public ThreadPoolTaskExecutor settlementCallExecutor(SettlementProperties properties) {
        int poolSize = Math.max(1, properties.getCallPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Math.max(0, properties.getCallQueueCapacity()));
        executor.setThreadNamePrefix("settlement-call-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public BatchSettlementProcessor batchSettlementProcessor(
            ClaimsLedger ledger,
            VaultReadService vaultReadService,
            ExternalLedgerClient ledgerClient,
            SettlementTransactionBuilder transactionBuilder,
            SettlementLease lease,
            @Qualifier("settlementVaultExecutor") ExecutorService vaultExecutor,
            @Qualifier("settlementCallExecutor") ThreadPoolTaskExecutor callExecutor,
            SettlementProperties properties,
            ClaimsMetrics metrics,
            Clock clock) {
        properties.checkLeaseCoversBatch();
        return new BatchSettlementProcessor(
            ledger,
            vaultReadService,
            new BackingValidator(vaultReadService, ledgerClient),
            transactionBuilder,
            lease,
            new SettlementBatcher(properties.getMaxTransactionBytes(), properties.getMaxBatchClaims()),
            RetryPolicy.from(properties),
            new ExternalCallExecutor(callExecutor, properties.getExternalCallTimeout()),
            vaultExecutor,
            properties,
            metrics,
            clock);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
