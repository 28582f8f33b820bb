package com.flagship.claims_ledger.vault;

import com.flagship.claims_ledger.exception.NotFoundException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read access to vaults, source transactions and contributed assets.
 *
 * These tables belong to the vault lifecycle subsystem; the claims core never
 * writes them except for asset status through {@link AssetStatusUpdater}.
 * Plain JDBC keeps the read model independent of that subsystem's entities.
 */
@Service
public class VaultReadService {

    private final JdbcTemplate jdbcTemplate;

    public VaultReadService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(readOnly = true)
    public Optional<Vault> findVault(UUID vaultId) {
        List<Vault> vaults = jdbcTemplate.query(
            """
            SELECT id, owner_id, name, status, token_supply, token_decimals,
                   acquirer_share_percent, lp_share_percent,
                   total_acquired_currency, total_assets_value, contract_address
            FROM vaults WHERE id = ?
            """,
            vaultRowMapper(),
            vaultId
        );
        return vaults.stream().findFirst();
    }

    /**
     * @throws NotFoundException if the vault does not exist
     */
    @Transactional(readOnly = true)
    public Vault getVault(UUID vaultId) {
        return findVault(vaultId)
            .orElseThrow(() -> new NotFoundException("Vault not found: " + vaultId));
    }

    /**
     * Confirmed contributions and acquisitions of a vault in creation order,
     * contributions carrying their assets.
     */
    @Transactional(readOnly = true)
    public List<SourceTransaction> findConfirmedTransactions(UUID vaultId) {
        List<SourceTransaction> transactions = jdbcTemplate.query(
            """
            SELECT id, vault_id, participant_id, kind, status, currency_amount, external_ref
            FROM source_transactions
            WHERE vault_id = ? AND status = 'CONFIRMED'
            ORDER BY created_at ASC, id ASC
            """,
            transactionRowMapper(),
            vaultId
        );
        return attachAssets(transactions, findAssetsForVault(vaultId));
    }

    @Transactional(readOnly = true)
    public Optional<SourceTransaction> findTransaction(UUID transactionId) {
        List<SourceTransaction> transactions = jdbcTemplate.query(
            """
            SELECT id, vault_id, participant_id, kind, status, currency_amount, external_ref
            FROM source_transactions WHERE id = ?
            """,
            transactionRowMapper(),
            transactionId
        );
        if (transactions.isEmpty()) {
            return Optional.empty();
        }
        List<ContributedAsset> assets = jdbcTemplate.query(
            ASSET_SELECT + " WHERE a.transaction_id = ? ORDER BY a.position ASC",
            assetRowMapper(),
            transactionId
        );
        return Optional.of(transactions.get(0).withAssets(assets));
    }

    private List<ContributedAsset> findAssetsForVault(UUID vaultId) {
        return jdbcTemplate.query(
            ASSET_SELECT + """
             JOIN source_transactions t ON t.id = a.transaction_id
             WHERE t.vault_id = ?
             ORDER BY a.transaction_id, a.position ASC
            """,
            assetRowMapper(),
            vaultId
        );
    }

    private List<SourceTransaction> attachAssets(List<SourceTransaction> transactions,
                                                 List<ContributedAsset> assets) {
        Map<UUID, List<ContributedAsset>> byTransaction = assets.stream()
            .collect(Collectors.groupingBy(ContributedAsset::getTransactionId));
        return transactions.stream()
            .map(tx -> tx.withAssets(byTransaction.getOrDefault(tx.getId(), List.of())))
            .toList();
    }

    private static final String ASSET_SELECT = """
        SELECT a.id, a.transaction_id, a.policy_id, a.asset_name, a.asset_type,
               a.quantity, a.unit_value, a.status
        FROM contributed_assets a
        """;

    private RowMapper<Vault> vaultRowMapper() {
        return (rs, rowNum) -> new Vault(
            rs.getObject("id", UUID.class),
            rs.getObject("owner_id", UUID.class),
            rs.getString("name"),
            VaultStatus.valueOf(rs.getString("status")),
            rs.getLong("token_supply"),
            rs.getInt("token_decimals"),
            rs.getDouble("acquirer_share_percent"),
            rs.getDouble("lp_share_percent"),
            rs.getDouble("total_acquired_currency"),
            rs.getDouble("total_assets_value"),
            rs.getString("contract_address")
        );
    }

    private RowMapper<SourceTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new SourceTransaction(
            rs.getObject("id", UUID.class),
            rs.getObject("vault_id", UUID.class),
            rs.getObject("participant_id", UUID.class),
            TransactionKind.valueOf(rs.getString("kind")),
            SourceTransactionStatus.valueOf(rs.getString("status")),
            rs.getDouble("currency_amount"),
            rs.getString("external_ref"),
            List.of()
        );
    }

    private RowMapper<ContributedAsset> assetRowMapper() {
        return (rs, rowNum) -> new ContributedAsset(
            rs.getObject("id", UUID.class),
            rs.getObject("transaction_id", UUID.class),
            rs.getString("policy_id"),
            rs.getString("asset_name"),
            rs.getString("asset_type"),
            rs.getLong("quantity"),
            rs.getDouble("unit_value"),
            AssetStatus.valueOf(rs.getString("status"))
        );
    }
}
