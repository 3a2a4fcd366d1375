package com.flagship.erp_ledger.purchase;

import com.flagship.erp_ledger.common.DocumentType;
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
import com.flagship.erp_ledger.purchase.dto.CreateDebitNoteRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.flagship.erp_ledger.posting.WellKnownAccount.ACCOUNTS_PAYABLE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.INVENTORY;

/**
 * Returns to vendors. Stock leaves at the original bill price and may not go negative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DebitNoteService {

    private final DebitNoteRepository debitNoteRepository;
    private final PurchaseBillService billService;
    private final DocumentNumberService documentNumberService;
    private final PostingConfigurationService postingConfiguration;
    private final PostingRules postingRules;
    private final LedgerService ledgerService;
    private final StockService stockService;

    @Transactional
    public DebitNote create(TenantScope scope, CreateDebitNoteRequest request) {
        PurchaseBill bill = billService.lock(scope, request.getBillId());
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.requireAll(ACCOUNTS_PAYABLE, INVENTORY);

        List<PurchaseBillItem> returnedItems = new ArrayList<>();
        List<StockMovement> movements = new ArrayList<>();
        for (ReturnItemRequest line : request.getItems()) {
            PurchaseBillItem item = bill.findItem(line.getItemId());
            if (item == null) {
                throw new ValidationException("Item " + line.getItemId() + " is not on " + bill.getDocumentLabel());
            }
            item.recordReturn(line.getQuantity());
            returnedItems.add(item);
            movements.add(StockMovement.out(item.getProductId(), line.getQuantity()));
        }
        stockService.apply(scope, movements);

        String number = documentNumberService.next(scope.getBusinessId(), DocumentType.DEBIT_NOTE);
        DebitNote note = DebitNote.create(scope, number, bill, request.getNoteDate(), request.getReason());
        for (int i = 0; i < returnedItems.size(); i++) {
            note.addReturn(returnedItems.get(i), request.getItems().get(i).getQuantity());
        }
        note = debitNoteRepository.save(note);

        DocumentRef ref = DocumentRef.builder()
            .businessId(note.getBusinessId())
            .branchId(note.getBranchId())
            .documentType(DocumentType.DEBIT_NOTE)
            .documentId(note.getId())
            .documentNumber(number)
            .transactionDate(note.getNoteDate())
            .vendorId(note.getVendorId())
            .build();
        PostingRequest posting = postingRules.debitNote(ref, bill.getBillNumber(), note.getTotalAmount(), accounts);
        if (posting.hasLines()) {
            ledgerService.post(posting);
        }

        log.info("Debit note created: number={}, bill={}, amount={}", number, bill.getBillNumber(),
                note.getTotalAmount());
        return note;
    }

    @Transactional(readOnly = true)
    public DebitNote get(TenantScope scope, UUID debitNoteId) {
        return debitNoteRepository.findByIdAndBusinessId(debitNoteId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Debit note", debitNoteId));
    }

    @Transactional(readOnly = true)
    public List<DebitNote> list(TenantScope scope, UUID billId) {
        return billId != null
            ? debitNoteRepository.findByBusinessIdAndBillIdOrderByCreatedAtDesc(scope.getBusinessId(), billId)
            : debitNoteRepository.findByBusinessIdOrderByCreatedAtDesc(scope.getBusinessId());
    }
}
