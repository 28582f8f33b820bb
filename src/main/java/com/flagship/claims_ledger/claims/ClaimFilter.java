package com.flagship.claims_ledger.claims;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.jpa.domain.Specification;

import java.util.UUID;

/**
 * Optional criteria for listing a participant's claims. Null fields match everything.
 */
@Value
@Builder
public class ClaimFilter {
    UUID vaultId;
    ClaimType type;
    ClaimStatus status;

    public static ClaimFilter none() {
        return ClaimFilter.builder().build();
    }

    Specification<ClaimEntity> toSpecification(UUID participantId) {
        Specification<ClaimEntity> spec = (root, query, cb) -> cb.equal(root.get("participantId"), participantId);
        if (vaultId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("vaultId"), vaultId));
        }
        if (type != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("type"), type));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        return spec;
    }
}
