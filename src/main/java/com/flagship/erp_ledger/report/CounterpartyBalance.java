package com.flagship.erp_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Receivable (customer) or payable (vendor) position of one counterparty, in the control account's sign
 * convention: positive means the customer owes us, or we owe the vendor.
 */
@Value
public class CounterpartyBalance {
    UUID counterpartyId;
    UUID accountId;
    BigDecimal debitTotal;
    BigDecimal creditTotal;
    BigDecimal balance;
}
