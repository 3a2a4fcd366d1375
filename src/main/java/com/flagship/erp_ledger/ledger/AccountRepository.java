package com.flagship.erp_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the chart of accounts. Every query is scoped to a business.
 */
@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private static final String COLUMNS =
        "id, business_id, code, name, account_type, parent_id, description, is_active, is_system, created_at";

    private final JdbcTemplate jdbcTemplate;

    public void insert(Account account) {
        jdbcTemplate.update(
            "INSERT INTO accounts (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getBusinessId(),
            account.getCode(),
            account.getName(),
            account.getType().name(),
            account.getParentId(),
            account.getDescription(),
            account.isActive(),
            account.isSystemAccount(),
            Timestamp.from(account.getCreatedAt())
        );
    }

    public void update(Account account) {
        jdbcTemplate.update(
            "UPDATE accounts SET code = ?, name = ?, account_type = ?, parent_id = ?, description = ?, is_active = ? " +
            "WHERE id = ? AND business_id = ?",
            account.getCode(),
            account.getName(),
            account.getType().name(),
            account.getParentId(),
            account.getDescription(),
            account.isActive(),
            account.getId(),
            account.getBusinessId()
        );
    }

    public void delete(UUID businessId, UUID accountId) {
        jdbcTemplate.update("DELETE FROM accounts WHERE id = ? AND business_id = ?", accountId, businessId);
    }

    public Optional<Account> findById(UUID businessId, UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE id = ? AND business_id = ?",
            accountRowMapper(), accountId, businessId
        ).stream().findFirst();
    }

    public Optional<Account> findByCode(UUID businessId, String code) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE business_id = ? AND code = ?",
            accountRowMapper(), businessId, code
        ).stream().findFirst();
    }

    /**
     * Active account with the given name; the oldest wins when names are duplicated.
     */
    public Optional<Account> findActiveByName(UUID businessId, String name) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE business_id = ? AND name = ? AND is_active = TRUE " +
            "ORDER BY created_at, code LIMIT 1",
            accountRowMapper(), businessId, name
        ).stream().findFirst();
    }

    public List<Account> findAll(UUID businessId, boolean includeInactive) {
        String sql = "SELECT " + COLUMNS + " FROM accounts WHERE business_id = ?"
            + (includeInactive ? "" : " AND is_active = TRUE")
            + " ORDER BY code";
        return jdbcTemplate.query(sql, accountRowMapper(), businessId);
    }

    public List<Account> findByType(UUID businessId, AccountType type) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE business_id = ? AND account_type = ? AND is_active = TRUE " +
            "ORDER BY code",
            accountRowMapper(), businessId, type.name()
        );
    }

    public List<Account> findAllById(UUID businessId, Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = String.join(", ", Collections.nCopies(accountIds.size(), "?"));
        Object[] args = new Object[accountIds.size() + 1];
        args[0] = businessId;
        int i = 1;
        for (UUID id : accountIds) {
            args[i++] = id;
        }
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE business_id = ? AND id IN (" + placeholders + ")",
            accountRowMapper(), args
        );
    }

    public boolean hasChildren(UUID businessId, UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE business_id = ? AND parent_id = ?",
            Integer.class, businessId, accountId
        );
        return count != null && count > 0;
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> Account.builder()
            .id(rs.getObject("id", UUID.class))
            .businessId(rs.getObject("business_id", UUID.class))
            .code(rs.getString("code"))
            .name(rs.getString("name"))
            .type(AccountType.valueOf(rs.getString("account_type")))
            .parentId(rs.getObject("parent_id", UUID.class))
            .description(rs.getString("description"))
            .active(rs.getBoolean("is_active"))
            .systemAccount(rs.getBoolean("is_system"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .build();
    }
}
