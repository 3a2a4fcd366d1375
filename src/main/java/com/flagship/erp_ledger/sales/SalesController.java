package com.flagship.erp_ledger.sales;

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
import com.flagship.erp_ledger.sales.dto.CreateCreditNoteRequest;
import com.flagship.erp_ledger.sales.dto.CreateInvoiceRequest;
import com.flagship.erp_ledger.sales.dto.CreditNoteResponse;
import com.flagship.erp_ledger.sales.dto.InvoiceResponse;
import com.flagship.erp_ledger.sales.dto.WriteOffRequest;
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

/**
 * Sales invoices and credit notes. Every POST that writes to the ledger requires an Idempotency-Key header;
 * replays answer 200 with the original document.
 */
@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
public class SalesController {

    private final SalesInvoiceService invoiceService;
    private final CreditNoteService creditNoteService;
    private final IdempotencyService idempotencyService;
    private final LedgerService ledgerService;

    @GetMapping("/invoices")
    public List<InvoiceResponse> listInvoices(TenantScope scope,
                                              @RequestParam(name = "status", required = false) String status) {
        SettlementStatus filter = status != null ? SettlementStatus.fromLabel(status) : null;
        return invoiceService.list(scope, filter).stream().map(InvoiceResponse::summary).toList();
    }

    @GetMapping("/invoices/next-number")
    public Map<String, String> nextInvoiceNumber(TenantScope scope) {
        return Map.of("next_number", invoiceService.nextNumber(scope));
    }

    @PostMapping("/invoices")
    public ResponseEntity<InvoiceResponse> createInvoice(TenantScope scope,
                                                         @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                         @Valid @RequestBody CreateInvoiceRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.CREATE_INVOICE,
            () -> invoiceService.create(scope, request).getId());
        return invoiceResponse(scope, result);
    }

    @GetMapping("/invoices/{id}")
    public InvoiceResponse getInvoice(TenantScope scope, @PathVariable("id") UUID id) {
        return InvoiceResponse.from(invoiceService.get(scope, id));
    }

    @GetMapping("/invoices/{id}/ledger")
    public List<LedgerEntryResponse> invoiceLedger(TenantScope scope, @PathVariable("id") UUID id) {
        invoiceService.get(scope, id);
        return ledgerService.getEntriesForDocument(scope.getBusinessId(), DocumentType.SALES_INVOICE, id).stream()
            .map(LedgerEntryResponse::from)
            .toList();
    }

    @PostMapping("/invoices/{id}/payments")
    public ResponseEntity<InvoiceResponse> recordPayment(TenantScope scope, @PathVariable("id") UUID id,
                                                         @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                         @Valid @RequestBody PaymentRequest request) {
        CorrelationContext.setDocumentId(id);
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.INVOICE_PAYMENT,
            () -> invoiceService.recordPayment(scope, id, request.getAmount(), request.getPaymentAccountId(),
                request.getPaymentDate()).getId());
        return invoiceResponse(scope, result);
    }

    @PostMapping("/invoices/{id}/write-off")
    public ResponseEntity<InvoiceResponse> writeOff(TenantScope scope, @PathVariable("id") UUID id,
                                                    @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                    @RequestBody(required = false) WriteOffRequest request) {
        CorrelationContext.setDocumentId(id);
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.INVOICE_WRITE_OFF,
            () -> invoiceService.writeOff(scope, id, request != null ? request.getWriteOffDate() : null).getId());
        return invoiceResponse(scope, result);
    }

    @GetMapping("/credit-notes")
    public List<CreditNoteResponse> listCreditNotes(TenantScope scope,
                                                    @RequestParam(name = "invoice_id", required = false) UUID invoiceId) {
        return creditNoteService.list(scope, invoiceId).stream().map(CreditNoteResponse::from).toList();
    }

    @PostMapping("/credit-notes")
    public ResponseEntity<CreditNoteResponse> createCreditNote(TenantScope scope,
                                                               @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                               @Valid @RequestBody CreateCreditNoteRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.CREATE_CREDIT_NOTE,
            () -> creditNoteService.create(scope, request).getId());
        CorrelationContext.setDocumentId(result.getResourceId());
        return ResponseEntity.status(result.responseStatus())
            .body(CreditNoteResponse.from(creditNoteService.get(scope, result.getResourceId())));
    }

    @GetMapping("/credit-notes/{id}")
    public CreditNoteResponse getCreditNote(TenantScope scope, @PathVariable("id") UUID id) {
        return CreditNoteResponse.from(creditNoteService.get(scope, id));
    }

    private ResponseEntity<InvoiceResponse> invoiceResponse(TenantScope scope, IdempotentResult result) {
        CorrelationContext.setDocumentId(result.getResourceId());
        return ResponseEntity.status(result.responseStatus())
            .body(InvoiceResponse.from(invoiceService.get(scope, result.getResourceId())));
    }
}
