package com.flagship.claims_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation ID handling and the MDC keys used across the service.
 *
 * HTTP requests take the ID from the X-Correlation-ID header; each settlement
 * sweep generates its own.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String VAULT_ID_MDC_KEY = "vaultId";
    public static final String CLAIM_ID_MDC_KEY = "claimId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Puts the ID in the MDC. A blank value generates a new one.
     */
    public static String begin(String id) {
        String value = id != null && !id.isBlank() ? id : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, value);
        return value;
    }

    /**
     * Clears every MDC key this class owns.
     */
    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(VAULT_ID_MDC_KEY);
        MDC.remove(CLAIM_ID_MDC_KEY);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
