package com.flagship.erp_ledger.posting;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class PostingAccountMappingRepository {

    private final JdbcTemplate jdbcTemplate;

    public Map<WellKnownAccount, UUID> findByBusiness(UUID businessId) {
        Map<WellKnownAccount, UUID> mappings = new EnumMap<>(WellKnownAccount.class);
        jdbcTemplate.query(
            "SELECT role, account_id FROM posting_account_mappings WHERE business_id = ?",
            rs -> {
                mappings.put(WellKnownAccount.valueOf(rs.getString("role")), rs.getObject("account_id", UUID.class));
            },
            businessId
        );
        return mappings;
    }

    public void upsert(UUID businessId, WellKnownAccount role, UUID accountId) {
        jdbcTemplate.update(
            "INSERT INTO posting_account_mappings (business_id, role, account_id, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (business_id, role) DO UPDATE SET account_id = EXCLUDED.account_id, updated_at = CURRENT_TIMESTAMP",
            businessId, role.name(), accountId
        );
    }
}
