package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.ledger.AccountType;

/**
 * Account roles that posting rules refer to. Each tenant maps every role to one of its own accounts,
 * by default the account carrying {@link #getDefaultName()}.
 */
public enum WellKnownAccount {
    ACCOUNTS_RECEIVABLE("1100", "Accounts Receivable", AccountType.ASSET),
    INVENTORY("1200", "Inventory", AccountType.ASSET),
    ACCUMULATED_DEPRECIATION("1500", "Accumulated Depreciation", AccountType.ASSET),
    ACCOUNTS_PAYABLE("2000", "Accounts Payable", AccountType.LIABILITY),
    VAT_PAYABLE("2100", "VAT Payable", AccountType.LIABILITY),
    PAYROLL_LIABILITIES("2200", "Payroll Liabilities", AccountType.LIABILITY),
    SALES_REVENUE("4000", "Sales Revenue", AccountType.REVENUE),
    OPERATING_EXPENSES("5000", "Operating Expenses", AccountType.EXPENSE),
    DEPRECIATION_EXPENSE("5100", "Depreciation Expense", AccountType.EXPENSE),
    SALARIES_EXPENSE("5200", "Salaries Expense", AccountType.EXPENSE);

    private final String defaultCode;
    private final String defaultName;
    private final AccountType expectedType;

    WellKnownAccount(String defaultCode, String defaultName, AccountType expectedType) {
        this.defaultCode = defaultCode;
        this.defaultName = defaultName;
        this.expectedType = expectedType;
    }

    public String getDefaultCode() {
        return defaultCode;
    }

    public String getDefaultName() {
        return defaultName;
    }

    public AccountType getExpectedType() {
        return expectedType;
    }
}
