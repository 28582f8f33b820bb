package com.flagship.claims_ledger.api;

import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.ClaimMaterializationService;
import com.flagship.claims_ledger.claims.ClaimMaterializationService.MaterializationResult;
import com.flagship.claims_ledger.claims.ClaimStatus;
import com.flagship.claims_ledger.claims.ClaimType;
import com.flagship.claims_ledger.exception.NotFoundException;
import com.flagship.claims_ledger.exception.ValidationException;
import com.flagship.claims_ledger.verification.ClaimsVerificationService;
import com.flagship.claims_ledger.verification.VerificationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(VaultClaimsController.class)
class VaultClaimsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ClaimMaterializationService materializationService;

    @MockBean
    private ClaimsVerificationService verificationService;

    private static Claim claim(UUID vaultId, ClaimType type) {
        return Claim.builder()
            .id(UUID.randomUUID())
            .participantId(UUID.randomUUID())
            .vaultId(vaultId)
            .type(type)
            .status(ClaimStatus.AVAILABLE)
            .build();
    }

    @Test
    @DisplayName("POST /claims reports created and kept claims")
    void testMaterialize() throws Exception {
        UUID vaultId = UUID.randomUUID();
        Claim created = claim(vaultId, ClaimType.ACQUIRER);
        when(materializationService.createClaimsForVault(vaultId))
            .thenReturn(new MaterializationResult(vaultId, null, List.of(created), 2, 1));

        mockMvc.perform(post("/api/vaults/{vaultId}/claims", vaultId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.vault_id").value(vaultId.toString()))
            .andExpect(jsonPath("$.created_claim_ids[0]").value(created.getId().toString()))
            .andExpect(jsonPath("$.kept").value(2))
            .andExpect(jsonPath("$.replaced").value(1));
    }

    @Test
    @DisplayName("Unknown vault is a 404")
    void testMaterialize_UnknownVault() throws Exception {
        UUID vaultId = UUID.randomUUID();
        when(materializationService.createClaimsForVault(vaultId))
            .thenThrow(new NotFoundException("Vault not found: " + vaultId));

        mockMvc.perform(post("/api/vaults/{vaultId}/claims", vaultId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Cancellation passes the reason through")
    void testCancel() throws Exception {
        UUID vaultId = UUID.randomUUID();
        when(materializationService.createCancellationClaims(vaultId, "threshold not met"))
            .thenReturn(new MaterializationResult(vaultId, null,
                List.of(claim(vaultId, ClaimType.CANCELLATION), claim(vaultId, ClaimType.CANCELLATION)), 0, 0));

        mockMvc.perform(post("/api/vaults/{vaultId}/cancellation-claims", vaultId)
                .param("reason", "threshold not met"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.created_claim_ids.length()").value(2));
    }

    @Test
    @DisplayName("Cancellation of a vault that has not failed is a 400")
    void testCancel_VaultNotFailed() throws Exception {
        UUID vaultId = UUID.randomUUID();
        when(materializationService.createCancellationClaims(eq(vaultId), anyString()))
            .thenThrow(new ValidationException("Vault " + vaultId + " is LOCKED"));

        mockMvc.perform(post("/api/vaults/{vaultId}/cancellation-claims", vaultId)
                .param("reason", "late"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("A blank reason is rejected before the service is called")
    void testCancel_BlankReason() throws Exception {
        UUID vaultId = UUID.randomUUID();

        mockMvc.perform(post("/api/vaults/{vaultId}/cancellation-claims", vaultId)
                .param("reason", "  "))
            .andExpect(status().isBadRequest());

        verify(materializationService, never()).createCancellationClaims(eq(vaultId), anyString());
    }

    @Test
    @DisplayName("Annotation returns the verification report")
    void testAnnotate() throws Exception {
        UUID vaultId = UUID.randomUUID();
        when(verificationService.annotate(vaultId)).thenReturn(VerificationReport.builder()
            .vaultId(vaultId)
            .verifiedAt(Instant.parse("2026-01-01T00:00:00Z"))
            .summary(VerificationReport.Summary.builder()
                .totalClaims(3).validClaims(2).claimsWithDiscrepancies(1).conserved(true)
                .claimsByType(Map.of()).build())
            .discrepancies(List.of())
            .participants(List.of())
            .build());

        mockMvc.perform(post("/api/vaults/{vaultId}/verification/annotations", vaultId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.claimsWithDiscrepancies").value(1))
            .andExpect(jsonPath("$.clean").value(false));
    }
}
