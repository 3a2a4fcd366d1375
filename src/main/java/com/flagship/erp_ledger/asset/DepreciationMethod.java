package com.flagship.erp_ledger.asset;

public enum DepreciationMethod {
    STRAIGHT_LINE
}
