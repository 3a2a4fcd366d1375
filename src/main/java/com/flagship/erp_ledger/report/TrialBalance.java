package com.flagship.erp_ledger.report;

import com.flagship.erp_ledger.ledger.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class TrialBalance {
    LocalDate asOf;
    List<Line> lines;
    BigDecimal totalDebit;
    BigDecimal totalCredit;

    public boolean isBalanced() {
        return totalDebit.compareTo(totalCredit) == 0;
    }

    /**
     * {@code balance} is the raw debit-minus-credit figure.
     */
    @Value
    public static class Line {
        UUID accountId;
        String accountCode;
        String accountName;
        AccountType accountType;
        BigDecimal debitTotal;
        BigDecimal creditTotal;
        BigDecimal balance;
    }
}
