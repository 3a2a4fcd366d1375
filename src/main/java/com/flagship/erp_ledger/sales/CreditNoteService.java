package com.flagship.erp_ledger.sales;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.dto.ReturnItemRequest;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.inventory.StockMovement;
import com.flagship.erp_ledger.inventory.StockService;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.ledger.PostingRequest;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import com.flagship.erp_ledger.posting.DocumentRef;
import com.flagship.erp_ledger.posting.PostingAccounts;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.posting.PostingRules;
import com.flagship.erp_ledger.sales.dto.CreateCreditNoteRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.flagship.erp_ledger.posting.WellKnownAccount.ACCOUNTS_RECEIVABLE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.SALES_REVENUE;

/**
 * Customer returns. Returned goods go back into stock at the original invoice price.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditNoteService {

    private final CreditNoteRepository creditNoteRepository;
    private final SalesInvoiceService invoiceService;
    private final DocumentNumberService documentNumberService;
    private final PostingConfigurationService postingConfiguration;
    private final PostingRules postingRules;
    private final LedgerService ledgerService;
    private final StockService stockService;

    @Transactional
    public CreditNote create(TenantScope scope, CreateCreditNoteRequest request) {
        SalesInvoice invoice = invoiceService.lock(scope, request.getInvoiceId());
        if (invoice.getStatus() == SettlementStatus.WRITTEN_OFF) {
            throw new ValidationException(invoice.getDocumentLabel() + " has been written off and cannot take returns");
        }
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.requireAll(SALES_REVENUE, ACCOUNTS_RECEIVABLE);

        List<SalesInvoiceItem> returnedItems = new ArrayList<>();
        for (ReturnItemRequest line : request.getItems()) {
            SalesInvoiceItem item = invoice.findItem(line.getItemId());
            if (item == null) {
                throw new ValidationException("Item " + line.getItemId() + " is not on " + invoice.getDocumentLabel());
            }
            item.recordReturn(line.getQuantity());
            returnedItems.add(item);
        }

        String number = documentNumberService.next(scope.getBusinessId(), DocumentType.CREDIT_NOTE);
        CreditNote note = CreditNote.create(scope, number, invoice, request.getNoteDate(), request.getReason());
        List<StockMovement> movements = new ArrayList<>();
        for (int i = 0; i < returnedItems.size(); i++) {
            SalesInvoiceItem item = returnedItems.get(i);
            note.addReturn(item, request.getItems().get(i).getQuantity());
            movements.add(StockMovement.in(item.getProductId(), request.getItems().get(i).getQuantity()));
        }
        stockService.apply(scope, movements);
        note = creditNoteRepository.save(note);

        DocumentRef ref = DocumentRef.builder()
            .businessId(note.getBusinessId())
            .branchId(note.getBranchId())
            .documentType(DocumentType.CREDIT_NOTE)
            .documentId(note.getId())
            .documentNumber(number)
            .transactionDate(note.getNoteDate())
            .customerId(note.getCustomerId())
            .build();
        PostingRequest posting = postingRules.creditNote(ref, invoice.getInvoiceNumber(), note.getTotalAmount(), accounts);
        if (posting.hasLines()) {
            ledgerService.post(posting);
        }

        log.info("Credit note created: number={}, invoice={}, amount={}", number, invoice.getInvoiceNumber(),
                note.getTotalAmount());
        return note;
    }

    @Transactional(readOnly = true)
    public CreditNote get(TenantScope scope, UUID creditNoteId) {
        return creditNoteRepository.findByIdAndBusinessId(creditNoteId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Credit note", creditNoteId));
    }

    @Transactional(readOnly = true)
    public List<CreditNote> list(TenantScope scope, UUID invoiceId) {
        return invoiceId != null
            ? creditNoteRepository.findByBusinessIdAndInvoiceIdOrderByCreatedAtDesc(scope.getBusinessId(), invoiceId)
            : creditNoteRepository.findByBusinessIdOrderByCreatedAtDesc(scope.getBusinessId());
    }
}
