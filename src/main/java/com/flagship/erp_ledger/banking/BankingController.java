package com.flagship.erp_ledger.banking;

import com.flagship.erp_ledger.banking.dto.BankAccountResponse;
import com.flagship.erp_ledger.banking.dto.BankTransactionRequest;
import com.flagship.erp_ledger.banking.dto.BankTransactionResponse;
import com.flagship.erp_ledger.banking.dto.CreateBankAccountRequest;
import com.flagship.erp_ledger.banking.dto.CreateFundTransferRequest;
import com.flagship.erp_ledger.banking.dto.FundTransferResponse;
import com.flagship.erp_ledger.banking.dto.ReconcileRequest;
import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.idempotency.IdempotencyService;
import com.flagship.erp_ledger.idempotency.IdempotentOperation;
import com.flagship.erp_ledger.idempotency.IdempotentResult;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/banking")
@RequiredArgsConstructor
public class BankingController {

    private final BankAccountService bankAccountService;
    private final FundTransferService fundTransferService;
    private final IdempotencyService idempotencyService;
    private final LedgerService ledgerService;

    @GetMapping("/accounts")
    public List<BankAccountResponse> listAccounts(TenantScope scope,
                                                  @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return bankAccountService.list(scope, includeInactive).stream().map(BankAccountResponse::from).toList();
    }

    @PostMapping("/accounts")
    public ResponseEntity<BankAccountResponse> createAccount(TenantScope scope,
                                                             @Valid @RequestBody CreateBankAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(BankAccountResponse.from(bankAccountService.create(scope, request)));
    }

    @GetMapping("/accounts/{id}")
    public BankAccountResponse getAccount(TenantScope scope, @PathVariable("id") UUID id) {
        return BankAccountResponse.from(bankAccountService.get(scope, id));
    }

    @DeleteMapping("/accounts/{id}")
    public ResponseEntity<Void> deleteAccount(TenantScope scope, @PathVariable("id") UUID id) {
        bankAccountService.delete(scope, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/accounts/{id}/deposits")
    public ResponseEntity<BankTransactionResponse> deposit(TenantScope scope, @PathVariable("id") UUID id,
                                                           @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                           @Valid @RequestBody BankTransactionRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.BANK_DEPOSIT,
            () -> bankAccountService.deposit(scope, id, request.getAmount(), request.getCounterAccountId(),
                request.getTransactionDate(), request.getDescription()));
        return transactionResponse(scope, result, DocumentType.BANK_DEPOSIT);
    }

    @PostMapping("/accounts/{id}/withdrawals")
    public ResponseEntity<BankTransactionResponse> withdraw(TenantScope scope, @PathVariable("id") UUID id,
                                                            @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                            @Valid @RequestBody BankTransactionRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.BANK_WITHDRAWAL,
            () -> bankAccountService.withdraw(scope, id, request.getAmount(), request.getCounterAccountId(),
                request.getTransactionDate(), request.getDescription()));
        return transactionResponse(scope, result, DocumentType.BANK_WITHDRAWAL);
    }

    @PostMapping("/accounts/{id}/reconcile")
    public Reconciliation reconcile(TenantScope scope, @PathVariable("id") UUID id,
                                    @Valid @RequestBody ReconcileRequest request) {
        return bankAccountService.reconcile(scope, id, request.getStatementBalance(), request.getStatementDate());
    }

    @GetMapping("/accounts/{id}/consistency")
    public BalanceConsistency consistency(TenantScope scope, @PathVariable("id") UUID id) {
        return bankAccountService.verifyConsistency(scope, id);
    }

    @PostMapping("/transfers")
    public ResponseEntity<FundTransferResponse> createTransfer(TenantScope scope,
                                                               @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                               @Valid @RequestBody CreateFundTransferRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.CREATE_FUND_TRANSFER,
            () -> fundTransferService.create(scope, request).getId());
        CorrelationContext.setDocumentId(result.getResourceId());
        return ResponseEntity.status(result.responseStatus())
            .body(FundTransferResponse.from(fundTransferService.get(scope, result.getResourceId())));
    }

    @GetMapping("/transfers")
    public List<FundTransferResponse> transferHistory(TenantScope scope,
                                                      @RequestParam(name = "bank_account_id", required = false) UUID bankAccountId,
                                                      @RequestParam(name = "start_date", required = false)
                                                      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                                      @RequestParam(name = "end_date", required = false)
                                                      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return fundTransferService.history(scope, bankAccountId, startDate, endDate).stream()
            .map(FundTransferResponse::from)
            .toList();
    }

    @GetMapping("/transfers/{id}")
    public FundTransferResponse getTransfer(TenantScope scope, @PathVariable("id") UUID id) {
        return FundTransferResponse.from(fundTransferService.get(scope, id));
    }

    private ResponseEntity<BankTransactionResponse> transactionResponse(TenantScope scope, IdempotentResult result,
                                                                        DocumentType type) {
        UUID documentId = result.getResourceId();
        CorrelationContext.setDocumentId(documentId);
        return ResponseEntity.status(result.responseStatus())
            .body(BankTransactionResponse.of(documentId, type,
                ledgerService.getEntriesForDocument(scope.getBusinessId(), type, documentId)));
    }
}
