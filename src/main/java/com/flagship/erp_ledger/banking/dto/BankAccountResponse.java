package com.flagship.erp_ledger.banking.dto;

import com.flagship.erp_ledger.banking.BankAccount;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class BankAccountResponse {
    UUID id;
    String accountName;
    String bankName;
    String accountNumber;
    String currency;
    UUID chartAccountId;
    BigDecimal currentBalance;
    LocalDate lastReconciledDate;
    BigDecimal lastReconciledBalance;
    boolean active;

    public static BankAccountResponse from(BankAccount account) {
        return BankAccountResponse.builder()
            .id(account.getId())
            .accountName(account.getAccountName())
            .bankName(account.getBankName())
            .accountNumber(account.getAccountNumber())
            .currency(account.getCurrency())
            .chartAccountId(account.getChartAccountId())
            .currentBalance(account.getCurrentBalance())
            .lastReconciledDate(account.getLastReconciledDate())
            .lastReconciledBalance(account.getLastReconciledBalance())
            .active(account.isActive())
            .build();
    }
}
