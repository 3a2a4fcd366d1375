package com.flagship.erp_ledger.banking;

import com.flagship.erp_ledger.banking.dto.CreateFundTransferRequest;
import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.InsufficientFundsException;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import com.flagship.erp_ledger.posting.DocumentRef;
import com.flagship.erp_ledger.posting.PostingRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Moves money between two bank accounts of the same business.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundTransferService {

    private final FundTransferRepository transferRepository;
    private final BankAccountRepository bankAccountRepository;
    private final DocumentNumberService documentNumberService;
    private final PostingRules postingRules;
    private final LedgerService ledgerService;

    /**
     * Dr destination, Cr source. Both accounts are locked in id order; the source must cover the amount
     * before anything is written.
     */
    @Transactional
    public FundTransfer create(TenantScope scope, CreateFundTransferRequest request) {
        if (request.getFromAccountId().equals(request.getToAccountId())) {
            throw new ValidationException("Source and destination accounts must be different");
        }
        if (!Money.isPositive(request.getAmount())) {
            throw new ValidationException("Transfer amount must be greater than zero");
        }
        scope.requireBranch();

        boolean fromFirst = request.getFromAccountId().compareTo(request.getToAccountId()) < 0;
        BankAccount first = lock(scope, fromFirst ? request.getFromAccountId() : request.getToAccountId());
        BankAccount second = lock(scope, fromFirst ? request.getToAccountId() : request.getFromAccountId());
        BankAccount from = fromFirst ? first : second;
        BankAccount to = fromFirst ? second : first;

        if (!from.isActive() || !to.isActive()) {
            throw new ValidationException("Transfers between inactive bank accounts are not allowed");
        }
        if (!from.canCover(request.getAmount())) {
            log.warn("Transfer rejected: from={}, balance={}, amount={}", from.getAccountName(),
                    from.getCurrentBalance(), request.getAmount());
            throw new InsufficientFundsException(from.getAccountName(), from.getCurrentBalance(), request.getAmount());
        }

        String number = documentNumberService.next(scope.getBusinessId(), DocumentType.FUND_TRANSFER);
        FundTransfer transfer = transferRepository.save(FundTransfer.create(scope, number, from, to,
            request.getAmount(), request.getTransferDate(), request.getDescription(), request.getReference()));

        DocumentRef ref = DocumentRef.builder()
            .businessId(scope.getBusinessId())
            .branchId(transfer.getBranchId())
            .documentType(DocumentType.FUND_TRANSFER)
            .documentId(transfer.getId())
            .documentNumber(number)
            .transactionDate(transfer.getTransferDate())
            .build();
        ledgerService.post(postingRules.fundTransfer(ref, from.getChartAccountId(), from.getAccountName(),
            to.getChartAccountId(), to.getAccountName(), transfer.getAmount(), transfer.getDescription()));

        log.info("Fund transfer {}: {} -> {}, amount={}", number, from.getAccountName(), to.getAccountName(),
                transfer.getAmount());
        return transfer;
    }

    @Transactional(readOnly = true)
    public FundTransfer get(TenantScope scope, UUID transferId) {
        return transferRepository.findByIdAndBusinessId(transferId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Fund transfer", transferId));
    }

    /**
     * Transfers touching {@code bankAccountId} (all transfers when null), newest first, within the optional
     * inclusive date range.
     */
    @Transactional(readOnly = true)
    public List<FundTransfer> history(TenantScope scope, UUID bankAccountId, LocalDate start, LocalDate end) {
        List<FundTransfer> transfers = bankAccountId != null
            ? transferRepository.findByBankAccount(scope.getBusinessId(), bankAccountId)
            : transferRepository.findByBusinessIdOrderByTransferDateDescCreatedAtDesc(scope.getBusinessId());
        return transfers.stream()
            .filter(transfer -> start == null || !transfer.getTransferDate().isBefore(start))
            .filter(transfer -> end == null || !transfer.getTransferDate().isAfter(end))
            .toList();
    }

    private BankAccount lock(TenantScope scope, UUID bankAccountId) {
        return bankAccountRepository.findForUpdate(bankAccountId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Bank account", bankAccountId));
    }
}
