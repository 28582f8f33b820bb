package com.flagship.claims_ledger.claims.metadata;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.claims_ledger.claims.ClaimType;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Typed metadata attached to a claim, one subclass per claim type.
 *
 * Stored as a single JSON column; the "kind" property selects the variant.
 * Fields declared here are shared bookkeeping written by settlement and
 * verification. Amount-bearing fields live on the variants and are fixed at
 * creation.
 */
@Getter
@SuperBuilder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ContributorClaimMetadata.class, name = "contributor"),
    @JsonSubTypes.Type(value = AcquirerClaimMetadata.class, name = "acquirer"),
    @JsonSubTypes.Type(value = LiquidityPoolClaimMetadata.class, name = "liquidity-pool"),
    @JsonSubTypes.Type(value = CancellationClaimMetadata.class, name = "cancellation"),
    @JsonSubTypes.Type(value = TerminationClaimMetadata.class, name = "termination"),
    @JsonSubTypes.Type(value = SecondaryRewardClaimMetadata.class, name = "secondary-reward")
})
public abstract class ClaimMetadata {

    /** Output of the source transaction that backs this claim. Defaults to 0. */
    private final Integer outputIndex;

    private final String error;
    private final String notes;

    private final String autoMarkedReason;
    private final String consumedBy;

    private final Integer settlementAttempts;
    private final Instant lastAttemptAt;

    private final Instant lastVerifiedAt;
    private final Long verificationTokenDifference;
    private final Long verificationCurrencyDifference;

    /**
     * The claim type this variant belongs to.
     */
    public abstract ClaimType claimType();

    public int outputIndexOrDefault() {
        return outputIndex != null ? outputIndex : 0;
    }
}
