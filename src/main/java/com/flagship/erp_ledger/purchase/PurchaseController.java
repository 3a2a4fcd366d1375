package com.flagship.erp_ledger.purchase;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.dto.PaymentRequest;
import com.flagship.erp_ledger.idempotency.IdempotencyService;
import com.flagship.erp_ledger.idempotency.IdempotentOperation;
import com.flagship.erp_ledger.idempotency.IdempotentResult;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.erp_ledger.observability.CorrelationContext;
import com.flagship.erp_ledger.purchase.dto.BillResponse;
import com.flagship.erp_ledger.purchase.dto.CreateBillRequest;
import com.flagship.erp_ledger.purchase.dto.CreateDebitNoteRequest;
import com.flagship.erp_ledger.purchase.dto.DebitNoteResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
public class PurchaseController {

    private final PurchaseBillService billService;
    private final DebitNoteService debitNoteService;
    private final IdempotencyService idempotencyService;
    private final LedgerService ledgerService;

    @GetMapping("/bills")
    public List<BillResponse> listBills(TenantScope scope,
                                        @RequestParam(name = "status", required = false) String status) {
        SettlementStatus filter = status != null ? SettlementStatus.fromLabel(status) : null;
        return billService.list(scope, filter).stream().map(BillResponse::summary).toList();
    }

    @GetMapping("/bills/next-number")
    public Map<String, String> nextBillNumber(TenantScope scope) {
        return Map.of("next_number", billService.nextNumber(scope));
    }

    @PostMapping("/bills")
    public ResponseEntity<BillResponse> createBill(TenantScope scope,
                                                   @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                   @Valid @RequestBody CreateBillRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.CREATE_BILL,
            () -> billService.create(scope, request).getId());
        return billResponse(scope, result);
    }

    @GetMapping("/bills/{id}")
    public BillResponse getBill(TenantScope scope, @PathVariable("id") UUID id) {
        return BillResponse.from(billService.get(scope, id));
    }

    @GetMapping("/bills/{id}/ledger")
    public List<LedgerEntryResponse> billLedger(TenantScope scope, @PathVariable("id") UUID id) {
        billService.get(scope, id);
        return ledgerService.getEntriesForDocument(scope.getBusinessId(), DocumentType.PURCHASE_BILL, id).stream()
            .map(LedgerEntryResponse::from)
            .toList();
    }

    @PostMapping("/bills/{id}/payments")
    public ResponseEntity<BillResponse> recordPayment(TenantScope scope, @PathVariable("id") UUID id,
                                                      @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                      @Valid @RequestBody PaymentRequest request) {
        CorrelationContext.setDocumentId(id);
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.BILL_PAYMENT,
            () -> billService.recordPayment(scope, id, request.getAmount(), request.getPaymentAccountId(),
                request.getPaymentDate()).getId());
        return billResponse(scope, result);
    }

    @GetMapping("/debit-notes")
    public List<DebitNoteResponse> listDebitNotes(TenantScope scope,
                                                  @RequestParam(name = "bill_id", required = false) UUID billId) {
        return debitNoteService.list(scope, billId).stream().map(DebitNoteResponse::from).toList();
    }

    @PostMapping("/debit-notes")
    public ResponseEntity<DebitNoteResponse> createDebitNote(TenantScope scope,
                                                             @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                             @Valid @RequestBody CreateDebitNoteRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.CREATE_DEBIT_NOTE,
            () -> debitNoteService.create(scope, request).getId());
        CorrelationContext.setDocumentId(result.getResourceId());
        return ResponseEntity.status(result.responseStatus())
            .body(DebitNoteResponse.from(debitNoteService.get(scope, result.getResourceId())));
    }

    @GetMapping("/debit-notes/{id}")
    public DebitNoteResponse getDebitNote(TenantScope scope, @PathVariable("id") UUID id) {
        return DebitNoteResponse.from(debitNoteService.get(scope, id));
    }

    private ResponseEntity<BillResponse> billResponse(TenantScope scope, IdempotentResult result) {
        CorrelationContext.setDocumentId(result.getResourceId());
        return ResponseEntity.status(result.responseStatus())
            .body(BillResponse.from(billService.get(scope, result.getResourceId())));
    }
}
