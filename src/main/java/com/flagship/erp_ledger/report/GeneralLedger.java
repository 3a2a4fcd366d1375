package com.flagship.erp_ledger.report;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Chronological entries with a running debit-minus-credit balance.
 */
@Value
public class GeneralLedger {
    UUID accountId;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal openingBalance;
    List<Line> lines;
    BigDecimal closingBalance;

    /**
     * Folds {@code entries}, already ordered by (transaction date, sequence), starting from {@code openingBalance}.
     */
    public static GeneralLedger fold(UUID accountId, LocalDate startDate, LocalDate endDate,
                                     BigDecimal openingBalance, List<LedgerEntry> entries) {
        BigDecimal running = Money.of(openingBalance);
        List<Line> lines = new ArrayList<>(entries.size());
        for (LedgerEntry entry : entries) {
            running = running.add(entry.getDebit()).subtract(entry.getCredit());
            lines.add(new Line(entry.getId(), entry.getAccountId(), entry.getTransactionDate(), entry.getDescription(),
                entry.getDocumentType(), entry.getDocumentNumber(), entry.getDebit(), entry.getCredit(),
                entry.getSequenceNumber(), running));
        }
        return new GeneralLedger(accountId, startDate, endDate, Money.of(openingBalance), lines, running);
    }

    @Value
    public static class Line {
        UUID entryId;
        UUID accountId;
        LocalDate transactionDate;
        String description;
        DocumentType documentType;
        String documentNumber;
        BigDecimal debit;
        BigDecimal credit;
        Long sequenceNumber;
        BigDecimal runningBalance;
    }
}
