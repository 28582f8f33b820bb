package com.flagship.claims_ledger.claims;

import com.flagship.claims_ledger.exception.InvalidTransitionException;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Allowed status edges of a claim.
 *
 * AVAILABLE -> CLAIMED is deliberately absent: it is reachable only through
 * backing recovery, see {@link #checkRecovery(UUID, ClaimStatus)}.
 */
public final class ClaimStateMachine {

    private static final Map<ClaimStatus, Set<ClaimStatus>> EDGES = Map.of(
        ClaimStatus.AVAILABLE, EnumSet.of(ClaimStatus.PENDING, ClaimStatus.FAILED),
        ClaimStatus.PENDING, EnumSet.of(ClaimStatus.CLAIMED, ClaimStatus.FAILED),
        ClaimStatus.CLAIMED, EnumSet.noneOf(ClaimStatus.class),
        ClaimStatus.FAILED, EnumSet.noneOf(ClaimStatus.class)
    );

    private ClaimStateMachine() {
        // Utility class
    }

    public static boolean canTransition(ClaimStatus from, ClaimStatus to) {
        return EDGES.get(from).contains(to);
    }

    /**
     * @throws InvalidTransitionException if the edge is not allowed
     */
    public static void checkTransition(UUID claimId, ClaimStatus from, ClaimStatus to) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(
                String.format("Claim %s cannot move from %s to %s", claimId, from, to));
        }
    }

    /**
     * Recovery marks a claim paid when its backing was already consumed.
     * Valid from AVAILABLE and PENDING.
     */
    public static void checkRecovery(UUID claimId, ClaimStatus from) {
        if (from != ClaimStatus.AVAILABLE && from != ClaimStatus.PENDING) {
            throw new InvalidTransitionException(
                String.format("Claim %s in %s status cannot be recovered as claimed", claimId, from));
        }
    }
}
