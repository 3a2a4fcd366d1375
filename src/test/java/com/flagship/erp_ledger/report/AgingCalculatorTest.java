package com.flagship.erp_ledger.report;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.sales.SalesInvoice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AgingCalculatorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 30);
    private final TenantScope scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID());

    private SalesInvoice invoice(String number, LocalDate dueDate, String amount) {
        SalesInvoice invoice = SalesInvoice.create(scope, number, UUID.randomUUID(), LocalDate.of(2024, 1, 1),
            dueDate, null, BigDecimal.ZERO);
        invoice.addItem(UUID.randomUUID(), null, BigDecimal.ONE, new BigDecimal(amount));
        invoice.recalculate();
        return invoice;
    }

    @Test
    @DisplayName("Bucket boundaries")
    void bucketBoundaries() {
        assertEquals(AgingBucket.CURRENT, AgingBucket.forDaysOverdue(-3));
        assertEquals(AgingBucket.CURRENT, AgingBucket.forDaysOverdue(0));
        assertEquals(AgingBucket.DAYS_1_30, AgingBucket.forDaysOverdue(1));
        assertEquals(AgingBucket.DAYS_1_30, AgingBucket.forDaysOverdue(30));
        assertEquals(AgingBucket.DAYS_31_60, AgingBucket.forDaysOverdue(31));
        assertEquals(AgingBucket.DAYS_61_90, AgingBucket.forDaysOverdue(90));
        assertEquals(AgingBucket.OVER_90, AgingBucket.forDaysOverdue(91));
    }

    @Test
    @DisplayName("An invoice 45 days past due lands in 31-60")
    void fortyFiveDaysOverdue() {
        SalesInvoice overdue = invoice("INV-00001", AS_OF.minusDays(45), "100.00");

        AgingReport report = AgingCalculator.age(List.of(overdue), SalesInvoice::getCustomerId, AS_OF);

        AgingLine line = report.getLines().get(0);
        assertEquals(45, line.getDaysOverdue());
        assertEquals(AgingBucket.DAYS_31_60, line.getBucket());
        assertEquals(new BigDecimal("100.00"), report.getBucketTotals().get(AgingBucket.DAYS_31_60));
    }

    @Test
    @DisplayName("Outstanding is total minus paid; settled documents are left out")
    void onlyOpenDocumentsAreAged() {
        SalesInvoice partial = invoice("INV-00002", AS_OF.plusDays(10), "80.00");
        partial.applyPayment(new BigDecimal("30.00"));
        SalesInvoice paid = invoice("INV-00003", AS_OF.minusDays(100), "50.00");
        paid.applyPayment(new BigDecimal("50.00"));
        SalesInvoice noDueDate = invoice("INV-00004", null, "20.00");

        AgingReport report = AgingCalculator.age(List.of(partial, paid, noDueDate), SalesInvoice::getCustomerId, AS_OF);

        assertEquals(2, report.getLines().size());
        assertEquals(new BigDecimal("70.00"), report.getTotalOutstanding());
        assertEquals(new BigDecimal("70.00"), report.getBucketTotals().get(AgingBucket.CURRENT));
        assertEquals(new BigDecimal("0.00"), report.getBucketTotals().get(AgingBucket.OVER_90));
    }
}
