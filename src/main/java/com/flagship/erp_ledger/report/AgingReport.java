package com.flagship.erp_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
public class AgingReport {
    LocalDate asOf;
    List<AgingLine> lines;
    Map<AgingBucket, BigDecimal> bucketTotals;
    BigDecimal totalOutstanding;
}
