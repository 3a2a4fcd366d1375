package com.flagship.erp_ledger.common;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Sub-total, VAT and grand total of a sales or purchase document.
 */
@Value
public class DocumentTotals {
    BigDecimal subTotal;
    BigDecimal vatAmount;
    BigDecimal totalAmount;

    /**
     * @param lineAmounts quantity x price of every line
     * @param vatRate     VAT percentage; null is treated as 0
     */
    public static DocumentTotals calculate(List<BigDecimal> lineAmounts, BigDecimal vatRate) {
        BigDecimal subTotal = Money.sum(lineAmounts);
        BigDecimal vat = Money.percentOf(subTotal, vatRate);
        return new DocumentTotals(subTotal, vat, Money.of(subTotal.add(vat)));
    }

    public static BigDecimal lineAmount(BigDecimal quantity, BigDecimal price) {
        return Money.of(quantity.multiply(price));
    }
}
