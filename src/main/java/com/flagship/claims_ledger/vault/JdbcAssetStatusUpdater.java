package com.flagship.claims_ledger.vault;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.UUID;

/**
 * Updates asset status in the shared vault schema.
 * Joins the caller's transaction so asset and claim updates commit together.
 */
@Component
@Slf4j
public class JdbcAssetStatusUpdater implements AssetStatusUpdater {

    private final JdbcTemplate jdbcTemplate;

    public JdbcAssetStatusUpdater(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public int markDistributed(Collection<UUID> assetIds) {
        int updated = 0;
        for (UUID assetId : assetIds) {
            updated += jdbcTemplate.update(
                "UPDATE contributed_assets SET status = 'DISTRIBUTED', updated_at = CURRENT_TIMESTAMP "
                    + "WHERE id = ? AND status = 'LOCKED'",
                assetId
            );
        }
        log.debug("Marked {} of {} assets as distributed", updated, assetIds.size());
        return updated;
    }
}
