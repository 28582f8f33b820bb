package com.flagship.claims_ledger.settlement;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A built settlement transaction. sizeBytes is its serialized size.
 */
@Value
@Builder
@Jacksonized
public class RawTransaction {
    String payload;
    int sizeBytes;
}
