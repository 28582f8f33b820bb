package com.flagship.claims_ledger.settlement;

/**
 * Builds and submits settlement transactions on the external ledger.
 *
 * Both calls may throw {@link com.flagship.claims_ledger.exception.TransportException},
 * which the processor retries. {@code build} may throw
 * {@link com.flagship.claims_ledger.exception.SizeLimitExceededException} when the
 * builder itself rejects the batch size.
 */
public interface SettlementTransactionBuilder {

    RawTransaction build(SettlementBatchSpec spec);

    /**
     * @return the settlement reference (transaction hash) on the external ledger
     */
    String submit(RawTransaction transaction);
}
