package com.flagship.claims_ledger.vault;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregates handed over by the phase scheduler when a vault's windows close.
 *
 * participantValues holds each contributor's total assessed value across all
 * of their contributions.
 */
@Value
public class VaultTotals {
    double acquiredCurrency;
    double contributedValue;
    Map<UUID, Double> participantValues;

    /**
     * Derives totals from confirmed source transactions.
     */
    public static VaultTotals fromTransactions(List<SourceTransaction> transactions) {
        double acquired = 0;
        double contributed = 0;
        Map<UUID, Double> perParticipant = new LinkedHashMap<>();
        for (SourceTransaction tx : transactions) {
            if (tx.isAcquisition()) {
                acquired += tx.getCurrencyAmount();
            } else {
                double value = tx.assessedValue();
                contributed += value;
                perParticipant.merge(tx.getParticipantId(), value, Double::sum);
            }
        }
        return new VaultTotals(acquired, contributed, Map.copyOf(perParticipant));
    }

    public double participantValue(UUID participantId) {
        return participantValues.getOrDefault(participantId, 0.0);
    }
}
