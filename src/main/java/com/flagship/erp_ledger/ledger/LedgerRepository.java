package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JDBC access to {@code ledger_entries}. Insert-only: the table rejects UPDATE and DELETE at the database
 * level and this class offers no path to either.
 */
@Repository
@RequiredArgsConstructor
public class LedgerRepository {

    private static final String COLUMNS =
        "id, business_id, branch_id, account_id, transaction_date, description, debit, credit, " +
        "document_type, document_id, document_number, customer_id, vendor_id, sequence_number, created_at";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Inserts one entry and returns it with the database-assigned sequence number.
     */
    public LedgerEntry insert(LedgerEntry entry) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO ledger_entries (id, business_id, branch_id, account_id, transaction_date, description, " +
            "debit, credit, document_type, document_id, document_number, customer_id, vendor_id) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING " + COLUMNS,
            entryRowMapper(),
            entry.getId(),
            entry.getBusinessId(),
            entry.getBranchId(),
            entry.getAccountId(),
            entry.getTransactionDate(),
            entry.getDescription(),
            entry.getDebit(),
            entry.getCredit(),
            entry.getDocumentType().name(),
            entry.getDocumentId(),
            entry.getDocumentNumber(),
            entry.getCustomerId(),
            entry.getVendorId()
        );
    }

    public List<LedgerEntry> findByDocument(UUID businessId, DocumentType documentType, UUID documentId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ledger_entries " +
            "WHERE business_id = ? AND document_type = ? AND document_id = ? ORDER BY sequence_number",
            entryRowMapper(), businessId, documentType.name(), documentId
        );
    }

    /**
     * Chronological listing ordered by (transaction_date, sequence_number).
     *
     * @param accountId optional; all accounts when null
     * @param from      inclusive lower bound, optional
     * @param to        inclusive upper bound, optional
     */
    public List<LedgerEntry> findEntries(UUID businessId, UUID accountId, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM ledger_entries WHERE business_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(businessId);
        if (accountId != null) {
            sql.append(" AND account_id = ?");
            args.add(accountId);
        }
        appendDateRange(sql, args, from, to);
        sql.append(" ORDER BY transaction_date, sequence_number");
        return jdbcTemplate.query(sql.toString(), entryRowMapper(), args.toArray());
    }

    public AccountTotals totalsForAccount(UUID businessId, UUID accountId, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(
            "SELECT COALESCE(SUM(debit), 0) AS debit_total, COALESCE(SUM(credit), 0) AS credit_total " +
            "FROM ledger_entries WHERE business_id = ? AND account_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(businessId);
        args.add(accountId);
        appendDateRange(sql, args, from, to);
        return jdbcTemplate.queryForObject(sql.toString(), totalsRowMapper(), args.toArray());
    }

    /**
     * Debit and credit totals of every account of the business that has entries in the range.
     */
    public Map<UUID, AccountTotals> totalsByAccount(UUID businessId, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(
            "SELECT account_id, SUM(debit) AS debit_total, SUM(credit) AS credit_total " +
            "FROM ledger_entries WHERE business_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(businessId);
        appendDateRange(sql, args, from, to);
        sql.append(" GROUP BY account_id");

        Map<UUID, AccountTotals> totals = new HashMap<>();
        jdbcTemplate.query(sql.toString(), rs -> {
            totals.put(rs.getObject("account_id", UUID.class),
                new AccountTotals(Money.of(rs.getBigDecimal("debit_total")), Money.of(rs.getBigDecimal("credit_total"))));
        }, args.toArray());
        return totals;
    }

    /**
     * Totals of one account restricted to entries tagged with a customer or a vendor.
     */
    public AccountTotals totalsForCounterparty(UUID businessId, UUID accountId, UUID customerId, UUID vendorId) {
        String column = customerId != null ? "customer_id" : "vendor_id";
        UUID counterpartyId = customerId != null ? customerId : vendorId;
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS debit_total, COALESCE(SUM(credit), 0) AS credit_total " +
            "FROM ledger_entries WHERE business_id = ? AND account_id = ? AND " + column + " = ?",
            totalsRowMapper(), businessId, accountId, counterpartyId
        );
    }

    public boolean existsForAccount(UUID businessId, UUID accountId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM ledger_entries WHERE business_id = ? AND account_id = ?)",
            Boolean.class, businessId, accountId
        );
        return Boolean.TRUE.equals(exists);
    }

    private void appendDateRange(StringBuilder sql, List<Object> args, LocalDate from, LocalDate to) {
        if (from != null) {
            sql.append(" AND transaction_date >= ?");
            args.add(from);
        }
        if (to != null) {
            sql.append(" AND transaction_date <= ?");
            args.add(to);
        }
    }

    private RowMapper<AccountTotals> totalsRowMapper() {
        return (rs, rowNum) -> new AccountTotals(
            Money.of(rs.getBigDecimal("debit_total")),
            Money.of(rs.getBigDecimal("credit_total"))
        );
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> LedgerEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .businessId(rs.getObject("business_id", UUID.class))
            .branchId(rs.getObject("branch_id", UUID.class))
            .accountId(rs.getObject("account_id", UUID.class))
            .transactionDate(rs.getObject("transaction_date", LocalDate.class))
            .description(rs.getString("description"))
            .debit(rs.getBigDecimal("debit"))
            .credit(rs.getBigDecimal("credit"))
            .documentType(DocumentType.valueOf(rs.getString("document_type")))
            .documentId(rs.getObject("document_id", UUID.class))
            .documentNumber(rs.getString("document_number"))
            .customerId(rs.getObject("customer_id", UUID.class))
            .vendorId(rs.getObject("vendor_id", UUID.class))
            .sequenceNumber(rs.getLong("sequence_number"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .build();
    }
}
