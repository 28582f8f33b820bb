package com.flagship.claims_ledger.api;

import com.flagship.claims_ledger.api.dto.ClaimPageResponse;
import com.flagship.claims_ledger.api.dto.SettleClaimsRequest;
import com.flagship.claims_ledger.api.dto.SettlementResponse;
import com.flagship.claims_ledger.claims.ClaimFilter;
import com.flagship.claims_ledger.claims.ClaimStatus;
import com.flagship.claims_ledger.claims.ClaimType;
import com.flagship.claims_ledger.claims.ClaimsLedger;
import com.flagship.claims_ledger.exception.ValidationException;
import com.flagship.claims_ledger.settlement.BatchSettlementProcessor;
import com.flagship.claims_ledger.verification.ClaimsVerificationService;
import com.flagship.claims_ledger.verification.VerificationFilter;
import com.flagship.claims_ledger.verification.VerificationReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Query and manual settlement surface over the claims ledger.
 *
 * Errors are mapped by {@link com.flagship.claims_ledger.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ClaimsController {

    static final int MAX_PAGE_SIZE = 100;

    private final ClaimsLedger ledger;
    private final ClaimsVerificationService verificationService;
    private final BatchSettlementProcessor settlementProcessor;

    /**
     * Lists a participant's claims, newest first.
     */
    @GetMapping("/claims")
    public ResponseEntity<ClaimPageResponse> getClaims(
            @RequestParam("participantId") UUID participantId,
            @RequestParam(value = "vaultId", required = false) UUID vaultId,
            @RequestParam(value = "type", required = false) ClaimType type,
            @RequestParam(value = "status", required = false) ClaimStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) {

        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }

        ClaimFilter filter = ClaimFilter.builder()
            .vaultId(vaultId)
            .type(type)
            .status(status)
            .build();
        PageRequest pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));

        return ResponseEntity.ok(ClaimPageResponse.from(ledger.getClaims(participantId, filter, pageable)));
    }

    @GetMapping("/vaults/{vaultId}/verification")
    public ResponseEntity<VerificationReport> verifyVault(
            @PathVariable("vaultId") UUID vaultId,
            @RequestParam(value = "participantId", required = false) UUID participantId,
            @RequestParam(value = "discrepanciesOnly", defaultValue = "false") boolean discrepanciesOnly) {

        VerificationFilter filter = VerificationFilter.builder()
            .participantId(participantId)
            .discrepanciesOnly(discrepanciesOnly)
            .build();
        return ResponseEntity.ok(verificationService.verify(vaultId, filter));
    }

    /**
     * Settles the given claims as one batch through the same path as the sweep.
     */
    @PostMapping("/settlements")
    public ResponseEntity<SettlementResponse> settle(@Valid @RequestBody SettleClaimsRequest request) {
        log.info("Manual settlement requested for {} claims", request.getClaimIds().size());
        try {
            String reference = settlementProcessor.settle(request.getClaimIds());
            MDC.put("settlementReference", reference);
            log.info("Manual settlement submitted");
            return ResponseEntity.ok(SettlementResponse.builder()
                .settlementReference(reference)
                .claimIds(request.getClaimIds())
                .build());
        } finally {
            MDC.remove("settlementReference");
        }
    }
}
