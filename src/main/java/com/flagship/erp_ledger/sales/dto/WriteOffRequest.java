package com.flagship.erp_ledger.sales.dto;

import lombok.Value;

import java.time.LocalDate;

@Value
public class WriteOffRequest {
    LocalDate writeOffDate;
}
