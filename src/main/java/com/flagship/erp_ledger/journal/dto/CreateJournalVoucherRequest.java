package com.flagship.erp_ledger.journal.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class CreateJournalVoucherRequest {

    @NotNull(message = "Voucher date is required")
    LocalDate voucherDate;

    String description;

    @Size(max = 100)
    String reference;

    @NotEmpty(message = "At least two lines are required")
    @Singular
    List<@Valid JournalLineRequest> lines;
}
