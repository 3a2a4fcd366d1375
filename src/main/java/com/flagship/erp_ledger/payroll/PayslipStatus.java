package com.flagship.erp_ledger.payroll;

public enum PayslipStatus {
    DRAFT,
    PAID
}
