package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.vault.SourceTransaction;
import com.flagship.claims_ledger.vault.VaultReadService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that the ledger output backing each claim is still spendable.
 *
 * A claim is backed by output {@code outputIndex} of its source transaction's
 * external reference. A claim without that reference cannot be backed and is
 * reported as missing. Validation never changes a claim.
 */
@RequiredArgsConstructor
@Slf4j
public class BackingValidator {

    private final VaultReadService vaultReadService;
    private final ExternalLedgerClient ledgerClient;

    /**
     * @throws com.flagship.claims_ledger.exception.TransportException if the ledger cannot be queried
     */
    public BackingCheck validate(List<Claim> claims) {
        BackingCheck check = new BackingCheck();
        for (Claim claim : claims) {
            Optional<String> reference = sourceReference(claim);
            if (reference.isEmpty()) {
                log.warn("Claim {} has no source transaction reference to back it", claim.getId());
                check.missing.add(claim);
                continue;
            }
            int outputIndex = claim.getMetadata() != null ? claim.getMetadata().outputIndexOrDefault() : 0;
            Optional<LedgerOutput> output = ledgerClient.findOutput(reference.get(), outputIndex);
            if (output.isEmpty()) {
                log.warn("Claim {} backing output {}#{} not found", claim.getId(), reference.get(), outputIndex);
                check.missing.add(claim);
            } else if (output.get().isConsumed()) {
                check.consumed.put(claim, output.get().getConsumedBy());
            } else {
                check.backed.add(claim);
            }
        }
        return check;
    }

    /**
     * Source transaction reference for a claim, if it has one.
     */
    public Optional<String> sourceReference(Claim claim) {
        if (claim.getSourceTransactionId() == null) {
            return Optional.empty();
        }
        return vaultReadService.findTransaction(claim.getSourceTransactionId())
            .map(SourceTransaction::getExternalRef)
            .filter(ref -> !ref.isBlank());
    }

    @Getter
    public static class BackingCheck {
        private final List<Claim> backed = new ArrayList<>();
        /** Claim to the transaction that already spent its output. */
        private final Map<Claim, String> consumed = new LinkedHashMap<>();
        private final List<Claim> missing = new ArrayList<>();
    }
}
