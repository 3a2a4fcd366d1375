package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One leg of a {@link PostingRequest}.
 */
@Value
public class PostingLine {
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;

    public boolean isZero() {
        return debit.signum() == 0 && credit.signum() == 0;
    }

    public static PostingLine of(UUID accountId, BigDecimal debit, BigDecimal credit, String description) {
        return new PostingLine(accountId, Money.orZero(debit), Money.orZero(credit), description);
    }

    public static PostingLine of(UUID accountId, EntryType entryType, BigDecimal amount, String description) {
        return entryType == EntryType.DEBIT
            ? debit(accountId, amount, description)
            : credit(accountId, amount, description);
    }

    public static PostingLine debit(UUID accountId, BigDecimal amount, String description) {
        return of(accountId, amount, Money.ZERO, description);
    }

    public static PostingLine credit(UUID accountId, BigDecimal amount, String description) {
        return of(accountId, Money.ZERO, amount, description);
    }
}
