package com.flagship.erp_ledger.sales;

import com.flagship.erp_ledger.common.DocumentTotals;
import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.dto.DocumentItemRequest;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.inventory.StockMovement;
import com.flagship.erp_ledger.inventory.StockService;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.ledger.PostingRequest;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import com.flagship.erp_ledger.posting.DocumentRef;
import com.flagship.erp_ledger.posting.PostingAccounts;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.posting.PostingRules;
import com.flagship.erp_ledger.sales.dto.CreateInvoiceRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.flagship.erp_ledger.posting.WellKnownAccount.ACCOUNTS_RECEIVABLE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.OPERATING_EXPENSES;
import static com.flagship.erp_ledger.posting.WellKnownAccount.SALES_REVENUE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.VAT_PAYABLE;

/**
 * Sales invoices: creation with stock issue, payments and bad-debt write-offs.
 *
 * Every method is one transaction; the invoice, its stock movements and its ledger entries commit together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SalesInvoiceService {

    private final SalesInvoiceRepository invoiceRepository;
    private final DocumentNumberService documentNumberService;
    private final PostingConfigurationService postingConfiguration;
    private final PostingRules postingRules;
    private final LedgerService ledgerService;
    private final StockService stockService;
    private final AccountService accountService;

    @Transactional
    public SalesInvoice create(TenantScope scope, CreateInvoiceRequest request) {
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.requireAll(ACCOUNTS_RECEIVABLE, SALES_REVENUE);
        if (Money.isPositive(request.getVatRate())) {
            accounts.require(VAT_PAYABLE);
        }
        scope.requireBranch();

        stockService.apply(scope, request.getItems().stream()
            .map(item -> StockMovement.out(item.getProductId(), item.getQuantity()))
            .toList());

        String number = documentNumberService.next(scope.getBusinessId(), DocumentType.SALES_INVOICE);
        SalesInvoice invoice = SalesInvoice.create(scope, number, request.getCustomerId(), request.getInvoiceDate(),
            request.getDueDate(), request.getNotes(), request.getVatRate());
        for (DocumentItemRequest item : request.getItems()) {
            invoice.addItem(item.getProductId(), item.getDescription(), item.getQuantity(), item.getPrice());
        }
        DocumentTotals totals = invoice.recalculate();
        invoice = invoiceRepository.save(invoice);

        PostingRequest posting = postingRules.salesInvoice(ref(invoice, invoice.getInvoiceDate()),
            totals.getSubTotal(), totals.getVatAmount(), totals.getTotalAmount(), accounts);
        if (posting.hasLines()) {
            ledgerService.post(posting);
        }

        log.info("Invoice created: number={}, customer={}, total={}", number, invoice.getCustomerId(),
                totals.getTotalAmount());
        return invoice;
    }

    /**
     * Records a payment received into {@code paymentAccountId} (cash or bank).
     */
    @Transactional
    public SalesInvoice recordPayment(TenantScope scope, UUID invoiceId, BigDecimal amount, UUID paymentAccountId,
                                      LocalDate paymentDate) {
        SalesInvoice invoice = lock(scope, invoiceId);
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.require(ACCOUNTS_RECEIVABLE);
        accountService.requirePaymentAccount(scope, paymentAccountId);

        SettlementStatus before = invoice.getStatus();
        invoice.applyPayment(amount);

        LocalDate date = paymentDate != null ? paymentDate : LocalDate.now();
        ledgerService.post(postingRules.invoicePayment(ref(invoice, date), amount, paymentAccountId, accounts));

        log.info("Payment recorded: invoice={}, amount={}, paid={}, status {} -> {}",
                invoice.getInvoiceNumber(), amount, invoice.getPaidAmount(), before, invoice.getStatus());
        return invoice;
    }

    /**
     * Writes the unpaid remainder off as bad debt.
     */
    @Transactional
    public SalesInvoice writeOff(TenantScope scope, UUID invoiceId, LocalDate writeOffDate) {
        SalesInvoice invoice = lock(scope, invoiceId);
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.requireAll(OPERATING_EXPENSES, ACCOUNTS_RECEIVABLE);

        BigDecimal remaining = invoice.writeOff();
        LocalDate date = writeOffDate != null ? writeOffDate : LocalDate.now();
        ledgerService.post(postingRules.invoiceWriteOff(ref(invoice, date), remaining, accounts));

        log.info("Invoice written off: number={}, amount={}", invoice.getInvoiceNumber(), remaining);
        return invoice;
    }

    @Transactional(readOnly = true)
    public String nextNumber(TenantScope scope) {
        return documentNumberService.peek(scope.getBusinessId(), DocumentType.SALES_INVOICE);
    }

    @Transactional(readOnly = true)
    public SalesInvoice get(TenantScope scope, UUID invoiceId) {
        return invoiceRepository.findByIdAndBusinessId(invoiceId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Invoice", invoiceId));
    }

    @Transactional(readOnly = true)
    public List<SalesInvoice> list(TenantScope scope, SettlementStatus status) {
        UUID businessId = scope.getBusinessId();
        UUID branchId = scope.getBranchId();
        if (branchId != null) {
            return status != null
                ? invoiceRepository.findByBusinessIdAndBranchIdAndStatusOrderByInvoiceDateDescCreatedAtDesc(businessId, branchId, status)
                : invoiceRepository.findByBusinessIdAndBranchIdOrderByInvoiceDateDescCreatedAtDesc(businessId, branchId);
        }
        return status != null
            ? invoiceRepository.findByBusinessIdAndStatusOrderByInvoiceDateDescCreatedAtDesc(businessId, status)
            : invoiceRepository.findByBusinessIdOrderByInvoiceDateDescCreatedAtDesc(businessId);
    }

    /**
     * Loads an invoice with a row lock for the rest of the caller's transaction.
     */
    @Transactional
    public SalesInvoice lock(TenantScope scope, UUID invoiceId) {
        return invoiceRepository.findForUpdate(invoiceId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Invoice", invoiceId));
    }

    private static DocumentRef ref(SalesInvoice invoice, LocalDate date) {
        return DocumentRef.builder()
            .businessId(invoice.getBusinessId())
            .branchId(invoice.getBranchId())
            .documentType(DocumentType.SALES_INVOICE)
            .documentId(invoice.getId())
            .documentNumber(invoice.getInvoiceNumber())
            .transactionDate(date)
            .customerId(invoice.getCustomerId())
            .build();
    }
}
