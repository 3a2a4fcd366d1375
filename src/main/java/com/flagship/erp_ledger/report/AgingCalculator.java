package com.flagship.erp_ledger.report;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.SettleableDocument;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Buckets open documents by days past due. A document without a due date counts as current.
 */
public final class AgingCalculator {

    private AgingCalculator() {
    }

    public static <T extends SettleableDocument> AgingReport age(List<T> documents, Function<T, UUID> counterparty,
                                                                 LocalDate asOf) {
        Map<AgingBucket, BigDecimal> totals = new EnumMap<>(AgingBucket.class);
        for (AgingBucket bucket : AgingBucket.values()) {
            totals.put(bucket, Money.ZERO);
        }

        List<AgingLine> lines = documents.stream()
            .filter(AgingCalculator::isOpen)
            .map(document -> line(document, counterparty.apply(document), asOf))
            .sorted(Comparator.comparingLong(AgingLine::getDaysOverdue).reversed()
                .thenComparing(AgingLine::getDocumentNumber))
            .toList();
        for (AgingLine line : lines) {
            totals.merge(line.getBucket(), line.getOutstanding(), BigDecimal::add);
        }

        return new AgingReport(asOf, lines, totals, Money.sum(lines.stream().map(AgingLine::getOutstanding).toList()));
    }

    public static long daysOverdue(LocalDate dueDate, LocalDate asOf) {
        return dueDate == null ? 0 : ChronoUnit.DAYS.between(dueDate, asOf);
    }

    private static boolean isOpen(SettleableDocument document) {
        return document.getStatus().isOpen();
    }

    private static AgingLine line(SettleableDocument document, UUID counterpartyId, LocalDate asOf) {
        long days = daysOverdue(document.getDueDate(), asOf);
        return AgingLine.builder()
            .documentId(document.getId())
            .documentNumber(document.getNumber())
            .counterpartyId(counterpartyId)
            .dueDate(document.getDueDate())
            .totalAmount(document.getTotalAmount())
            .paidAmount(document.getPaidAmount())
            .outstanding(document.getOutstanding())
            .daysOverdue(days)
            .bucket(AgingBucket.forDaysOverdue(days))
            .build();
    }
}
