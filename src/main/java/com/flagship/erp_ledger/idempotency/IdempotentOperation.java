package com.flagship.erp_ledger.idempotency;

/**
 * Operations guarded by an Idempotency-Key. A key belongs to exactly one operation.
 */
public enum IdempotentOperation {
    CREATE_JOURNAL_VOUCHER,
    CREATE_INVOICE,
    INVOICE_PAYMENT,
    INVOICE_WRITE_OFF,
    CREATE_CREDIT_NOTE,
    CREATE_BILL,
    BILL_PAYMENT,
    CREATE_DEBIT_NOTE,
    CREATE_FUND_TRANSFER,
    BANK_DEPOSIT,
    BANK_WITHDRAWAL,
    RECORD_DEPRECIATION,
    PAYSLIP_PAYMENT
}
