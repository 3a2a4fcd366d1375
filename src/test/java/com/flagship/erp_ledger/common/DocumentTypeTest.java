package com.flagship.erp_ledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentTypeTest {

    @Test
    @DisplayName("Document numbers are the prefix followed by a five digit sequence")
    void formatsNumbers() {
        assertEquals("INV-00001", DocumentType.SALES_INVOICE.format(1));
        assertEquals("JV-00042", DocumentType.JOURNAL_VOUCHER.format(42));
        assertEquals("FT-12345", DocumentType.FUND_TRANSFER.format(12345));
        assertEquals("PS-123456", DocumentType.PAYSLIP.format(123456));
    }

    @Test
    @DisplayName("Deposits are not numbered")
    void unnumberedTypesRefuseToFormat() {
        assertFalse(DocumentType.BANK_DEPOSIT.isNumbered());
        assertThrows(IllegalStateException.class, () -> DocumentType.BANK_DEPOSIT.format(1));
    }

    @Test
    @DisplayName("Numbers in the generated shape are recognised per type")
    void recognisesGeneratedNumbers() {
        assertTrue(DocumentType.PURCHASE_BILL.isGeneratedNumber("PO-00002"));
        assertTrue(DocumentType.PURCHASE_BILL.isGeneratedNumber("PO-123456"));
        assertFalse(DocumentType.PURCHASE_BILL.isGeneratedNumber("SUP-77"));
        assertFalse(DocumentType.PURCHASE_BILL.isGeneratedNumber("PO-12"));
        assertFalse(DocumentType.SALES_INVOICE.isGeneratedNumber("PO-00002"));
        assertFalse(DocumentType.BANK_DEPOSIT.isGeneratedNumber("PO-00002"));
    }
}
