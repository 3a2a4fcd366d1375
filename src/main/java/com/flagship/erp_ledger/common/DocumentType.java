package com.flagship.erp_ledger.common;

import java.util.regex.Pattern;

/**
 * Source documents that produce ledger entries.
 *
 * Numbered types draw per-tenant numbers of the form {@code PREFIX-00001}.
 */
public enum DocumentType {
    JOURNAL_VOUCHER("JV-"),
    SALES_INVOICE("INV-"),
    PURCHASE_BILL("PO-"),
    CREDIT_NOTE("CN-"),
    DEBIT_NOTE("DN-"),
    FUND_TRANSFER("FT-"),
    PAYSLIP("PS-"),
    BANK_DEPOSIT(null),
    BANK_WITHDRAWAL(null),
    FIXED_ASSET(null);

    private final String prefix;

    DocumentType(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isNumbered() {
        return prefix != null;
    }

    public String format(long sequence) {
        if (!isNumbered()) {
            throw new IllegalStateException(name() + " documents are not numbered");
        }
        return String.format("%s%05d", prefix, sequence);
    }

    /**
     * Whether {@code number} has the shape {@link #format} produces, e.g. {@code PO-00002}.
     */
    public boolean isGeneratedNumber(String number) {
        return isNumbered() && number != null && number.matches(Pattern.quote(prefix) + "\\d{5,}");
    }
}
