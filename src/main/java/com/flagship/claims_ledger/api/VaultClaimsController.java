package com.flagship.claims_ledger.api;

import com.flagship.claims_ledger.api.dto.MaterializationResponse;
import com.flagship.claims_ledger.claims.ClaimMaterializationService;
import com.flagship.claims_ledger.exception.ValidationException;
import com.flagship.claims_ledger.verification.ClaimsVerificationService;
import com.flagship.claims_ledger.verification.VerificationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Operator triggers for one vault. The phase scheduler calls the same services in-process.
 */
@RestController
@RequestMapping("/api/vaults/{vaultId}")
@RequiredArgsConstructor
@Slf4j
public class VaultClaimsController {

    private final ClaimMaterializationService materializationService;
    private final ClaimsVerificationService verificationService;

    @PostMapping("/claims")
    public ResponseEntity<MaterializationResponse> materialize(@PathVariable("vaultId") UUID vaultId) {
        log.info("Claim materialization requested for vault {}", vaultId);
        return ResponseEntity.ok(MaterializationResponse.from(materializationService.createClaimsForVault(vaultId)));
    }

    @PostMapping("/cancellation-claims")
    public ResponseEntity<MaterializationResponse> cancel(
            @PathVariable("vaultId") UUID vaultId,
            @RequestParam("reason") String reason) {
        if (reason.isBlank()) {
            throw new ValidationException("reason must not be blank");
        }
        log.info("Cancellation claims requested for vault {}: {}", vaultId, reason);
        return ResponseEntity.ok(MaterializationResponse.from(
            materializationService.createCancellationClaims(vaultId, reason)));
    }

    /**
     * Verifies the vault and stamps the outcome into each claim's metadata.
     */
    @PostMapping("/verification/annotations")
    public ResponseEntity<VerificationReport> annotate(@PathVariable("vaultId") UUID vaultId) {
        return ResponseEntity.ok(verificationService.annotate(vaultId));
    }
}
