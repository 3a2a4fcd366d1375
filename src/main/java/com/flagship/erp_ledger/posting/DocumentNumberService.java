package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.common.DocumentType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Per-tenant, per-type document numbers ({@code INV-00001}, {@code INV-00002}, ...).
 *
 * The counter row is incremented with an upsert, which holds a row lock until the surrounding transaction
 * ends: concurrent creators serialize and a rolled-back document releases its number.
 */
@Service
@RequiredArgsConstructor
public class DocumentNumberService {

    private final JdbcTemplate jdbcTemplate;

    @Transactional
    public String next(UUID businessId, DocumentType type) {
        Long value = jdbcTemplate.queryForObject(
            "INSERT INTO document_sequences (business_id, document_type, last_value) VALUES (?, ?, 1) " +
            "ON CONFLICT (business_id, document_type) " +
            "DO UPDATE SET last_value = document_sequences.last_value + 1 " +
            "RETURNING last_value",
            Long.class, businessId, type.name()
        );
        return type.format(value);
    }

    /**
     * The number {@link #next} would return now, without consuming it.
     */
    @Transactional(readOnly = true)
    public String peek(UUID businessId, DocumentType type) {
        List<Long> current = jdbcTemplate.queryForList(
            "SELECT last_value FROM document_sequences WHERE business_id = ? AND document_type = ?",
            Long.class, businessId, type.name()
        );
        return type.format(current.isEmpty() ? 1 : current.get(0) + 1);
    }
}
