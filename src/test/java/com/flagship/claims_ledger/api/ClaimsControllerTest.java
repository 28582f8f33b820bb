package com.flagship.claims_ledger.api;

import com.flagship.claims_ledger.claims.Claim;
import com.flagship.claims_ledger.claims.ClaimFilter;
import com.flagship.claims_ledger.claims.ClaimStatus;
import com.flagship.claims_ledger.claims.ClaimType;
import com.flagship.claims_ledger.claims.ClaimsLedger;
import com.flagship.claims_ledger.claims.metadata.ContributorClaimMetadata;
import com.flagship.claims_ledger.exception.InsufficientBackingException;
import com.flagship.claims_ledger.exception.NotFoundException;
import com.flagship.claims_ledger.exception.SettlementBusyException;
import com.flagship.claims_ledger.exception.SizeLimitExceededException;
import com.flagship.claims_ledger.exception.TransportException;
import com.flagship.claims_ledger.settlement.BatchSettlementProcessor;
import com.flagship.claims_ledger.verification.ClaimsVerificationService;
import com.flagship.claims_ledger.verification.VerificationFilter;
import com.flagship.claims_ledger.verification.VerificationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP contract of the claims API: parameters, response shape and error status mapping.
 */
@WebMvcTest(ClaimsController.class)
class ClaimsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ClaimsLedger ledger;

    @MockBean
    private ClaimsVerificationService verificationService;

    @MockBean
    private BatchSettlementProcessor settlementProcessor;

    private static String settleBody(UUID... ids) {
        StringBuilder json = new StringBuilder("{\"claim_ids\":[");
        for (int i = 0; i < ids.length; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append('"').append(ids[i]).append('"');
        }
        return json.append("]}").toString();
    }

    @Test
    @DisplayName("GET /api/claims returns a page of snake_case claims")
    void testGetClaims_ReturnsPage() throws Exception {
        UUID participantId = UUID.randomUUID();
        Claim claim = Claim.builder()
            .id(UUID.randomUUID())
            .participantId(participantId)
            .vaultId(UUID.randomUUID())
            .type(ClaimType.CONTRIBUTOR)
            .status(ClaimStatus.AVAILABLE)
            .tokenAmount(475_000L)
            .currencyAmount(90_000_000L)
            .metadata(ContributorClaimMetadata.builder().share(1.0).build())
            .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
            .build();
        when(ledger.getClaims(eq(participantId), any(ClaimFilter.class), any(Pageable.class)))
            .thenReturn(new PageImpl<>(List.of(claim), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/claims")
                .param("participantId", participantId.toString())
                .param("status", "AVAILABLE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.items[0].token_amount").value(475000))
            .andExpect(jsonPath("$.items[0].currency_amount").value(90000000))
            .andExpect(jsonPath("$.items[0].participant_id").value(participantId.toString()))
            .andExpect(jsonPath("$.items[0].metadata.kind").value("contributor"));

        ArgumentCaptor<ClaimFilter> filter = ArgumentCaptor.forClass(ClaimFilter.class);
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(ledger).getClaims(eq(participantId), filter.capture(), pageable.capture());
        assertEquals(ClaimStatus.AVAILABLE, filter.getValue().getStatus());
        assertNull(filter.getValue().getVaultId());
        assertEquals(Sort.Direction.DESC, pageable.getValue().getSort().getOrderFor("createdAt").getDirection());
    }

    @Test
    @DisplayName("participantId is required")
    void testGetClaims_MissingParticipant() throws Exception {
        mockMvc.perform(get("/api/claims"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Page size above the maximum is rejected")
    void testGetClaims_PageSizeTooLarge() throws Exception {
        mockMvc.perform(get("/api/claims")
                .param("participantId", UUID.randomUUID().toString())
                .param("size", "500"))
            .andExpect(status().isBadRequest());
        verify(ledger, never()).getClaims(any(UUID.class), any(), any());
    }

    @Test
    @DisplayName("Verification passes filter parameters through")
    void testVerifyVault() throws Exception {
        UUID vaultId = UUID.randomUUID();
        UUID participantId = UUID.randomUUID();
        VerificationReport report = VerificationReport.builder()
            .vaultId(vaultId)
            .verifiedAt(Instant.parse("2026-01-01T00:00:00Z"))
            .summary(VerificationReport.Summary.builder()
                .totalClaims(3).validClaims(3).conserved(true).claimsByType(Map.of()).build())
            .discrepancies(List.of())
            .participants(List.of())
            .build();
        when(verificationService.verify(eq(vaultId), any(VerificationFilter.class))).thenReturn(report);

        mockMvc.perform(get("/api/vaults/{vaultId}/verification", vaultId)
                .param("participantId", participantId.toString())
                .param("discrepanciesOnly", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.totalClaims").value(3))
            .andExpect(jsonPath("$.clean").value(true));

        ArgumentCaptor<VerificationFilter> filter = ArgumentCaptor.forClass(VerificationFilter.class);
        verify(verificationService).verify(eq(vaultId), filter.capture());
        assertEquals(participantId, filter.getValue().getParticipantId());
        assertTrue(filter.getValue().isDiscrepanciesOnly());
    }

    @Test
    @DisplayName("Unknown vault maps to 404")
    void testVerifyVault_NotFound() throws Exception {
        UUID vaultId = UUID.randomUUID();
        when(verificationService.verify(eq(vaultId), any())).thenThrow(new NotFoundException("Vault not found"));

        mockMvc.perform(get("/api/vaults/{vaultId}/verification", vaultId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /api/settlements returns the settlement reference")
    void testSettle_Success() throws Exception {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        when(settlementProcessor.settle(List.of(first, second))).thenReturn("tx-settle-1");

        mockMvc.perform(post("/api/settlements")
                .contentType(MediaType.APPLICATION_JSON)
                .content(settleBody(first, second)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.settlement_reference").value("tx-settle-1"))
            .andExpect(jsonPath("$.claim_ids.length()").value(2));
    }

    @Test
    @DisplayName("An empty claim list fails bean validation")
    void testSettle_EmptyRequest() throws Exception {
        mockMvc.perform(post("/api/settlements")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"claim_ids\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.claimIds").exists());
        verify(settlementProcessor, never()).settle(anyList());
    }

    @Test
    @DisplayName("Settlement errors map to 409, 413, 422 and 502")
    void testSettle_ErrorMapping() throws Exception {
        UUID busy = UUID.randomUUID();
        UUID large = UUID.randomUUID();
        UUID unbacked = UUID.randomUUID();
        UUID unreachable = UUID.randomUUID();
        when(settlementProcessor.settle(List.of(busy)))
            .thenThrow(new SettlementBusyException("Another settlement is in progress"));
        when(settlementProcessor.settle(List.of(large)))
            .thenThrow(new SizeLimitExceededException("Transaction too large"));
        when(settlementProcessor.settle(List.of(unbacked)))
            .thenThrow(new InsufficientBackingException("Backing output not found"));
        when(settlementProcessor.settle(List.of(unreachable)))
            .thenThrow(new TransportException("builder unreachable"));

        mockMvc.perform(post("/api/settlements").contentType(MediaType.APPLICATION_JSON).content(settleBody(busy)))
            .andExpect(status().isConflict());
        mockMvc.perform(post("/api/settlements").contentType(MediaType.APPLICATION_JSON).content(settleBody(large)))
            .andExpect(status().isPayloadTooLarge());
        mockMvc.perform(post("/api/settlements").contentType(MediaType.APPLICATION_JSON).content(settleBody(unbacked)))
            .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/api/settlements").contentType(MediaType.APPLICATION_JSON).content(settleBody(unreachable)))
            .andExpect(status().isBadGateway());
    }
}
