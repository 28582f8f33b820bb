package com.flagship.claims_ledger.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodic trigger for {@link BatchSettlementProcessor#runSweep}.
 *
 * Can be disabled via settlement.enabled=false (default) for tests and for
 * instances that should only serve queries.
 */
@Component
@ConditionalOnProperty(name = "settlement.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SettlementSweep {

    private final BatchSettlementProcessor processor;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${settlement.sweep-interval-ms:60000}",
               initialDelayString = "${settlement.initial-delay-ms:10000}")
    public void sweep() {
        try {
            processor.runSweep(clock.instant());
        } catch (Exception e) {
            log.error("Settlement sweep failed: {}", e.getMessage(), e);
        }
    }
}
