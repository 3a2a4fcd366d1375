package com.flagship.erp_ledger.ledger.dto;

import com.flagship.erp_ledger.ledger.AccountBalance;
import com.flagship.erp_ledger.ledger.AccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AccountBalanceResponse {
    UUID accountId;
    String code;
    String name;
    AccountType accountType;
    BigDecimal debitTotal;
    BigDecimal creditTotal;
    BigDecimal rawBalance;
    BigDecimal balance;

    public static AccountBalanceResponse from(AccountBalance balance) {
        return AccountBalanceResponse.builder()
            .accountId(balance.getAccount().getId())
            .code(balance.getAccount().getCode())
            .name(balance.getAccount().getName())
            .accountType(balance.getAccount().getType())
            .debitTotal(balance.getDebitTotal())
            .creditTotal(balance.getCreditTotal())
            .rawBalance(balance.getRawBalance())
            .balance(balance.getBalance())
            .build();
    }
}
