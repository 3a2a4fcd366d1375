package com.flagship.erp_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class StatementLine {
    UUID accountId;
    String accountCode;
    String accountName;
    BigDecimal amount;
}
