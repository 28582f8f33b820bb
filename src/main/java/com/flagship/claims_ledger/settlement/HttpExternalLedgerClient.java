package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * JSON-over-HTTP adapter for the ledger indexer.
 *
 * GET {base}/outputs/{transactionRef}/{outputIndex}; 404 means the output is unknown.
 */
@Slf4j
public class HttpExternalLedgerClient implements ExternalLedgerClient {

    private final RestClient restClient;

    public HttpExternalLedgerClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<LedgerOutput> findOutput(String transactionRef, int outputIndex) {
        try {
            LedgerOutput output = restClient.get()
                .uri("/outputs/{transactionRef}/{outputIndex}", transactionRef, outputIndex)
                .retrieve()
                .body(LedgerOutput.class);
            return Optional.ofNullable(output);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Output {}#{} not found on ledger", transactionRef, outputIndex);
            return Optional.empty();
        } catch (RestClientException e) {
            throw new TransportException("Ledger lookup failed for " + transactionRef + "#" + outputIndex, e);
        }
    }
}
