package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.exception.SizeLimitExceededException;
import com.flagship.claims_ledger.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * JSON-over-HTTP adapter for the transaction builder service.
 *
 * POST {base}/transactions/build returns a {@link RawTransaction};
 * POST {base}/transactions/submit returns {"reference": "..."}.
 * A 413 from the builder is reported as {@link SizeLimitExceededException}.
 */
@Slf4j
public class HttpSettlementTransactionBuilder implements SettlementTransactionBuilder {

    private final RestClient restClient;

    public HttpSettlementTransactionBuilder(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public RawTransaction build(SettlementBatchSpec spec) {
        try {
            RawTransaction transaction = restClient.post()
                .uri("/transactions/build")
                .contentType(MediaType.APPLICATION_JSON)
                .body(spec)
                .retrieve()
                .body(RawTransaction.class);
            if (transaction == null) {
                throw new TransportException("Transaction builder returned an empty body");
            }
            return transaction;
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.PAYLOAD_TOO_LARGE.value()) {
                throw new SizeLimitExceededException(
                    "Builder rejected batch of " + spec.getPayouts().size() + " claims as too large");
            }
            throw new TransportException("Transaction build failed: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new TransportException("Transaction build failed", e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public String submit(RawTransaction transaction) {
        try {
            Map<String, Object> response = restClient.post()
                .uri("/transactions/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .body(transaction)
                .retrieve()
                .body(Map.class);
            Object reference = response != null ? response.get("reference") : null;
            if (reference == null) {
                throw new TransportException("Submit response carried no reference");
            }
            log.debug("Submitted settlement transaction {}", reference);
            return reference.toString();
        } catch (RestClientException e) {
            throw new TransportException("Transaction submit failed", e);
        }
    }
}
