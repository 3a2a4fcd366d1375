package com.flagship.erp_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Balance of an account derived from its ledger entries.
 * {@code balance} follows the account type's sign convention; {@code rawBalance} is always debit minus credit.
 */
@Value
public class AccountBalance {
    Account account;
    BigDecimal debitTotal;
    BigDecimal creditTotal;
    BigDecimal rawBalance;
    BigDecimal balance;

    public static AccountBalance of(Account account, AccountTotals totals) {
        BigDecimal raw = totals.getRawBalance();
        return new AccountBalance(account, totals.getDebitTotal(), totals.getCreditTotal(), raw,
            account.getType().toReported(raw));
    }
}
