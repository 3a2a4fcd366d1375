package com.flagship.erp_ledger.banking.dto;

import com.flagship.erp_ledger.banking.FundTransfer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class FundTransferResponse {
    UUID id;
    String transferNumber;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    LocalDate transferDate;
    String description;
    String reference;

    public static FundTransferResponse from(FundTransfer transfer) {
        return FundTransferResponse.builder()
            .id(transfer.getId())
            .transferNumber(transfer.getTransferNumber())
            .fromAccountId(transfer.getFromAccountId())
            .toAccountId(transfer.getToAccountId())
            .amount(transfer.getAmount())
            .transferDate(transfer.getTransferDate())
            .description(transfer.getDescription())
            .reference(transfer.getReference())
            .build();
    }
}
