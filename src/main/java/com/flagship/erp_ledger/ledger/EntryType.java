package com.flagship.erp_ledger.ledger;

/**
 * Side of a double-entry line.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
