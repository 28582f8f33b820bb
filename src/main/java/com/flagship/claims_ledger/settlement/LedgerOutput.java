package com.flagship.claims_ledger.settlement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One output on the external ledger. consumedBy is the spending transaction, null while unspent.
 */
@Value
@Builder
@Jacksonized
public class LedgerOutput {
    String transactionRef;
    int outputIndex;
    String consumedBy;

    @JsonIgnore
    public boolean isConsumed() {
        return consumedBy != null && !consumedBy.isBlank();
    }
}
