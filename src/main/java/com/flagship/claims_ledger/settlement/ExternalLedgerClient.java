package com.flagship.claims_ledger.settlement;

import java.util.Optional;

/**
 * Read access to the external ledger.
 */
public interface ExternalLedgerClient {

    /**
     * @return the output, or empty if the ledger does not know it
     * @throws com.flagship.claims_ledger.exception.TransportException if the ledger cannot be reached
     */
    Optional<LedgerOutput> findOutput(String transactionRef, int outputIndex);
}
