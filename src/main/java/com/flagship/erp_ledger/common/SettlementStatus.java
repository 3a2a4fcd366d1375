package com.flagship.erp_ledger.common;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Payment status of an invoice or bill.
 */
public enum SettlementStatus {
    UNPAID("Unpaid"),
    PARTIAL("Partial"),
    PAID("Paid"),
    WRITTEN_OFF("Written Off");

    private final String label;

    SettlementStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isOpen() {
        return this == UNPAID || this == PARTIAL;
    }

    /**
     * Status after a payment has been applied. Zero paid keeps the current status.
     */
    public static SettlementStatus afterPayment(SettlementStatus current, BigDecimal paid, BigDecimal total) {
        if (paid.compareTo(total) >= 0) {
            return PAID;
        }
        if (paid.signum() > 0) {
            return PARTIAL;
        }
        return current;
    }

    public static SettlementStatus fromLabel(String value) {
        for (SettlementStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + value);
    }
}
