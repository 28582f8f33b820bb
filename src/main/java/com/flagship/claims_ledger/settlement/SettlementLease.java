package com.flagship.claims_ledger.settlement;

import java.time.Duration;
import java.util.Optional;

/**
 * Cluster-wide mutual exclusion with automatic expiry.
 *
 * A holder that crashes loses the lease after its TTL. Releasing a lease that
 * has expired or was taken over by another holder is a no-op.
 */
public interface SettlementLease {

    /**
     * @return a handle if acquired, empty if another holder has it
     */
    Optional<LeaseHandle> tryAcquire(String name, Duration ttl);

    /**
     * Extends the lease to {@code ttl} from now if the handle still holds it.
     *
     * @return false if the lease expired or changed hands
     */
    boolean renew(LeaseHandle handle, Duration ttl);

    void release(LeaseHandle handle);
}
