package com.flagship.erp_ledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DocumentTotalsTest {

    @Test
    @DisplayName("Totals of two lines with 10% VAT")
    void calculatesSubTotalVatAndTotal() {
        // Given: 2 x 10.00 and 1 x 5.00 at 10% VAT
        List<BigDecimal> lines = List.of(
            DocumentTotals.lineAmount(new BigDecimal("2"), new BigDecimal("10.00")),
            DocumentTotals.lineAmount(BigDecimal.ONE, new BigDecimal("5.00")));

        // When
        DocumentTotals totals = DocumentTotals.calculate(lines, new BigDecimal("10"));

        // Then
        assertEquals(new BigDecimal("25.00"), totals.getSubTotal());
        assertEquals(new BigDecimal("2.50"), totals.getVatAmount());
        assertEquals(new BigDecimal("27.50"), totals.getTotalAmount());
    }

    @Test
    @DisplayName("Missing VAT rate means no VAT")
    void nullVatRateIsZero() {
        DocumentTotals totals = DocumentTotals.calculate(List.of(new BigDecimal("99.99")), null);

        assertEquals(new BigDecimal("99.99"), totals.getSubTotal());
        assertEquals(Money.ZERO, totals.getVatAmount());
        assertEquals(new BigDecimal("99.99"), totals.getTotalAmount());
    }

    @Test
    @DisplayName("VAT is rounded half-up to cents")
    void vatRoundsHalfUp() {
        // 7.5% of 10.10 = 0.7575
        DocumentTotals totals = DocumentTotals.calculate(List.of(new BigDecimal("10.10")), new BigDecimal("7.5"));

        assertEquals(new BigDecimal("0.76"), totals.getVatAmount());
        assertEquals(new BigDecimal("10.86"), totals.getTotalAmount());
    }

    @Test
    @DisplayName("Line amount of fractional quantity is rounded to cents")
    void lineAmountRounds() {
        assertEquals(new BigDecimal("3.33"), DocumentTotals.lineAmount(new BigDecimal("0.333"), new BigDecimal("10.00")));
    }
}
