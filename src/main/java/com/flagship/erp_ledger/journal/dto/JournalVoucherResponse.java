package com.flagship.erp_ledger.journal.dto;

import com.flagship.erp_ledger.journal.JournalVoucher;
import com.flagship.erp_ledger.ledger.LedgerEntry;
import com.flagship.erp_ledger.ledger.dto.LedgerEntryResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class JournalVoucherResponse {
    UUID id;
    String voucherNumber;
    LocalDate voucherDate;
    String description;
    String reference;
    BigDecimal totalAmount;
    boolean posted;
    Instant postedAt;
    List<LedgerEntryResponse> lines;

    public static JournalVoucherResponse from(JournalVoucher voucher, List<LedgerEntry> entries) {
        return JournalVoucherResponse.builder()
            .id(voucher.getId())
            .voucherNumber(voucher.getVoucherNumber())
            .voucherDate(voucher.getVoucherDate())
            .description(voucher.getDescription())
            .reference(voucher.getReference())
            .totalAmount(voucher.getTotalAmount())
            .posted(voucher.isPosted())
            .postedAt(voucher.getPostedAt())
            .lines(entries.stream().map(LedgerEntryResponse::from).toList())
            .build();
    }
}
