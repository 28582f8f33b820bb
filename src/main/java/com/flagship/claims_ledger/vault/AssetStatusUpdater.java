package com.flagship.claims_ledger.vault;

import java.util.Collection;
import java.util.UUID;

/**
 * Marks contributed assets as paid out so they are not offered again.
 */
public interface AssetStatusUpdater {

    /**
     * @return number of assets whose status changed
     */
    int markDistributed(Collection<UUID> assetIds);
}
