package com.flagship.erp_ledger.journal;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.UnbalancedPostingException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.journal.dto.CreateJournalVoucherRequest;
import com.flagship.erp_ledger.journal.dto.JournalLineRequest;
import com.flagship.erp_ledger.ledger.LedgerEntry;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.ledger.PostingLine;
import com.flagship.erp_ledger.ledger.PostingRequest;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final JournalVoucherRepository voucherRepository;
    private final DocumentNumberService documentNumberService;
    private final LedgerService ledgerService;

    /**
     * Creates a voucher and writes its lines to the ledger.
     *
     * The lines are checked for balance before a number is drawn or anything is saved.
     */
    @Transactional
    public JournalVoucher create(TenantScope scope, CreateJournalVoucherRequest request) {
        List<PostingLine> lines = request.getLines().stream()
            .map(line -> PostingLine.of(line.getAccountId(), line.getDebit(), line.getCredit(), line.getDescription()))
            .toList();
        if (lines.size() < 2) {
            throw new ValidationException("A journal voucher needs at least two lines");
        }
        BigDecimal debits = Money.sum(lines.stream().map(PostingLine::getDebit).toList());
        BigDecimal credits = Money.sum(lines.stream().map(PostingLine::getCredit).toList());
        if (debits.compareTo(credits) != 0) {
            log.warn("Journal voucher rejected: debits={}, credits={}", debits, credits);
            throw new UnbalancedPostingException(debits, credits);
        }

        String number = documentNumberService.next(scope.getBusinessId(), DocumentType.JOURNAL_VOUCHER);
        JournalVoucher voucher = voucherRepository.save(JournalVoucher.create(scope, number,
            request.getVoucherDate(), request.getDescription(), request.getReference(), debits));

        ledgerService.post(PostingRequest.builder()
            .businessId(scope.getBusinessId())
            .branchId(voucher.getBranchId())
            .transactionDate(voucher.getVoucherDate())
            .description(describe(voucher))
            .documentType(DocumentType.JOURNAL_VOUCHER)
            .documentId(voucher.getId())
            .documentNumber(number)
            .lines(lines.stream().map(line -> withDefaultDescription(line, describe(voucher))).toList())
            .build());

        log.info("Journal voucher created: number={}, amount={}, lines={}", number, debits, lines.size());
        return voucher;
    }

    @Transactional
    public JournalVoucher post(TenantScope scope, UUID voucherId) {
        JournalVoucher voucher = get(scope, voucherId);
        voucher.markPosted();
        log.info("Journal voucher posted: number={}", voucher.getVoucherNumber());
        return voucher;
    }

    @Transactional(readOnly = true)
    public JournalVoucher get(TenantScope scope, UUID voucherId) {
        return voucherRepository.findByIdAndBusinessId(voucherId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Journal voucher", voucherId));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getLines(TenantScope scope, UUID voucherId) {
        return ledgerService.getEntriesForDocument(scope.getBusinessId(), DocumentType.JOURNAL_VOUCHER, voucherId);
    }

    @Transactional(readOnly = true)
    public List<JournalVoucher> list(TenantScope scope) {
        return scope.getBranchId() != null
            ? voucherRepository.findByBusinessIdAndBranchIdOrderByVoucherDateDescCreatedAtDesc(scope.getBusinessId(), scope.getBranchId())
            : voucherRepository.findByBusinessIdOrderByVoucherDateDescCreatedAtDesc(scope.getBusinessId());
    }

    private static String describe(JournalVoucher voucher) {
        return voucher.getDescription() != null && !voucher.getDescription().isBlank()
            ? voucher.getDescription()
            : "Journal Voucher " + voucher.getVoucherNumber();
    }

    private static PostingLine withDefaultDescription(PostingLine line, String fallback) {
        if (line.getDescription() != null && !line.getDescription().isBlank()) {
            return line;
        }
        return PostingLine.of(line.getAccountId(), line.getDebit(), line.getCredit(), fallback);
    }
}
