package com.flagship.erp_ledger.sales.dto;

import com.flagship.erp_ledger.common.dto.ReturnItemRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CreateCreditNoteRequest {

    @NotNull(message = "Invoice is required")
    UUID invoiceId;

    @NotNull(message = "Credit note date is required")
    LocalDate noteDate;

    String reason;

    @NotEmpty(message = "At least one item must be returned")
    @Singular
    List<@Valid ReturnItemRequest> items;
}
