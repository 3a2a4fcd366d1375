package com.flagship.erp_ledger.purchase;

import com.flagship.erp_ledger.banking.BankAccountService;
import com.flagship.erp_ledger.common.DocumentTotals;
import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.dto.DocumentItemRequest;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
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
import com.flagship.erp_ledger.purchase.dto.CreateBillRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.flagship.erp_ledger.posting.WellKnownAccount.ACCOUNTS_PAYABLE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.INVENTORY;
import static com.flagship.erp_ledger.posting.WellKnownAccount.VAT_PAYABLE;

/**
 * Purchase bills: creation with stock receipt, and payments to vendors.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseBillService {

    private final PurchaseBillRepository billRepository;
    private final DocumentNumberService documentNumberService;
    private final PostingConfigurationService postingConfiguration;
    private final PostingRules postingRules;
    private final LedgerService ledgerService;
    private final StockService stockService;
    private final AccountService accountService;
    private final BankAccountService bankAccountService;

    @Transactional
    public PurchaseBill create(TenantScope scope, CreateBillRequest request) {
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.requireAll(INVENTORY, ACCOUNTS_PAYABLE);
        if (Money.isPositive(request.getVatRate())) {
            accounts.require(VAT_PAYABLE);
        }
        scope.requireBranch();

        String supplierNumber = request.getBillNumber();
        boolean supplied = supplierNumber != null && !supplierNumber.isBlank();
        if (supplied && DocumentType.PURCHASE_BILL.isGeneratedNumber(supplierNumber)) {
            throw new ValidationException("Bill number " + supplierNumber + " uses the reserved "
                + DocumentType.PURCHASE_BILL.getPrefix() + " numbering; leave it empty to have one assigned");
        }
        if (supplied && billRepository.existsByBusinessIdAndBillNumber(scope.getBusinessId(), supplierNumber)) {
            throw new ValidationException("Bill number " + supplierNumber + " already exists");
        }

        stockService.apply(scope, request.getItems().stream()
            .map(item -> StockMovement.in(item.getProductId(), item.getQuantity()))
            .toList());

        String number = supplied
            ? supplierNumber
            : documentNumberService.next(scope.getBusinessId(), DocumentType.PURCHASE_BILL);
        if (!supplied && billRepository.existsByBusinessIdAndBillNumber(scope.getBusinessId(), number)) {
            throw new ValidationException("Bill number " + number + " already exists");
        }
        PurchaseBill bill = PurchaseBill.create(scope, number, request.getVendorId(), request.getBillDate(),
            request.getDueDate(), request.getNotes(), request.getVatRate());
        for (DocumentItemRequest item : request.getItems()) {
            bill.addItem(item.getProductId(), item.getDescription(), item.getQuantity(), item.getPrice());
        }
        DocumentTotals totals = bill.recalculate();
        bill = billRepository.save(bill);

        PostingRequest posting = postingRules.purchaseBill(ref(bill, bill.getBillDate()),
            totals.getSubTotal(), totals.getVatAmount(), totals.getTotalAmount(), accounts);
        if (posting.hasLines()) {
            ledgerService.post(posting);
        }

        log.info("Bill created: number={}, vendor={}, total={}", number, bill.getVendorId(), totals.getTotalAmount());
        return bill;
    }

    /**
     * Pays a vendor from {@code paymentAccountId}. A chart account that backs a bank account must hold enough funds.
     */
    @Transactional
    public PurchaseBill recordPayment(TenantScope scope, UUID billId, BigDecimal amount, UUID paymentAccountId,
                                      LocalDate paymentDate) {
        PurchaseBill bill = lock(scope, billId);
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.require(ACCOUNTS_PAYABLE);
        accountService.requirePaymentAccount(scope, paymentAccountId);
        bankAccountService.assertSufficientFunds(scope.getBusinessId(), paymentAccountId, amount);

        SettlementStatus before = bill.getStatus();
        bill.applyPayment(amount);

        LocalDate date = paymentDate != null ? paymentDate : LocalDate.now();
        ledgerService.post(postingRules.billPayment(ref(bill, date), amount, paymentAccountId, accounts));

        log.info("Bill payment recorded: bill={}, amount={}, paid={}, status {} -> {}",
                bill.getBillNumber(), amount, bill.getPaidAmount(), before, bill.getStatus());
        return bill;
    }

    @Transactional(readOnly = true)
    public String nextNumber(TenantScope scope) {
        return documentNumberService.peek(scope.getBusinessId(), DocumentType.PURCHASE_BILL);
    }

    @Transactional(readOnly = true)
    public PurchaseBill get(TenantScope scope, UUID billId) {
        return billRepository.findByIdAndBusinessId(billId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Bill", billId));
    }

    @Transactional(readOnly = true)
    public List<PurchaseBill> list(TenantScope scope, SettlementStatus status) {
        UUID businessId = scope.getBusinessId();
        UUID branchId = scope.getBranchId();
        if (branchId != null) {
            return status != null
                ? billRepository.findByBusinessIdAndBranchIdAndStatusOrderByBillDateDescCreatedAtDesc(businessId, branchId, status)
                : billRepository.findByBusinessIdAndBranchIdOrderByBillDateDescCreatedAtDesc(businessId, branchId);
        }
        return status != null
            ? billRepository.findByBusinessIdAndStatusOrderByBillDateDescCreatedAtDesc(businessId, status)
            : billRepository.findByBusinessIdOrderByBillDateDescCreatedAtDesc(businessId);
    }

    @Transactional
    public PurchaseBill lock(TenantScope scope, UUID billId) {
        return billRepository.findForUpdate(billId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Bill", billId));
    }

    private static DocumentRef ref(PurchaseBill bill, LocalDate date) {
        return DocumentRef.builder()
            .businessId(bill.getBusinessId())
            .branchId(bill.getBranchId())
            .documentType(DocumentType.PURCHASE_BILL)
            .documentId(bill.getId())
            .documentNumber(bill.getBillNumber())
            .transactionDate(date)
            .vendorId(bill.getVendorId())
            .build();
    }
}
