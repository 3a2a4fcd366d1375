package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.exception.ErpException;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.UnbalancedPostingException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.event.LedgerPostedEvent;
import com.flagship.erp_ledger.observability.PostingMetrics;
import com.flagship.erp_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The single write path into the ledger.
 *
 * A posting is validated completely before the first row is written:
 * <ol>
 *   <li>at least two lines</li>
 *   <li>amounts non-negative with at most two decimals, at least one non-zero side per line</li>
 *   <li>total debits equal total credits</li>
 *   <li>every account exists in the business and is active</li>
 * </ol>
 * Entries, listener side effects and the outbox event then join the caller's transaction, so a document
 * and its entries commit or roll back together.
 */
@Service
@Slf4j
public class LedgerService {

    private final AccountRepository accountRepository;
    private final LedgerRepository ledgerRepository;
    private final List<LedgerPostingListener> listeners;
    private final OutboxService outboxService;
    private final PostingMetrics postingMetrics;

    public LedgerService(AccountRepository accountRepository,
                         LedgerRepository ledgerRepository,
                         List<LedgerPostingListener> listeners,
                         OutboxService outboxService,
                         PostingMetrics postingMetrics) {
        this.accountRepository = accountRepository;
        this.ledgerRepository = ledgerRepository;
        this.listeners = listeners;
        this.outboxService = outboxService;
        this.postingMetrics = postingMetrics;
    }

    /**
     * Posts a balanced set of lines for one document.
     *
     * @return the written entries in insertion order
     * @throws UnbalancedPostingException if debits and credits differ
     * @throws ValidationException        if the request is malformed or an account is inactive
     * @throws NotFoundException          if an account does not exist in the business
     */
    @Transactional
    public List<LedgerEntry> post(PostingRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            validate(request);
        } catch (ErpException e) {
            postingMetrics.recordPostingRejected(request.getDocumentType(), e.getErrorCode());
            log.warn("Posting rejected: documentType={}, documentNumber={}, reason={}",
                    request.getDocumentType(), request.getDocumentNumber(), e.getMessage());
            throw e;
        }

        List<LedgerEntry> written = new ArrayList<>(request.getLines().size());
        for (PostingLine line : request.getLines()) {
            written.add(ledgerRepository.insert(toEntry(request, line)));
        }

        for (LedgerPostingListener listener : listeners) {
            listener.onPosted(request, written);
        }

        outboxService.saveEvent(request.getDocumentType().name(), request.getDocumentId(),
                LedgerPostedEvent.EVENT_TYPE, LedgerPostedEvent.from(request, written));

        long duration = System.currentTimeMillis() - startTime;
        postingMetrics.recordPosting(request.getDocumentType(), written.size(), duration);
        log.info("Posted {} {}: entries={}, amount={}, duration={}ms",
                request.getDocumentType(), request.getDocumentNumber(), written.size(),
                request.getDebitTotal(), duration);
        if (log.isDebugEnabled()) {
            written.forEach(entry -> log.debug("  entry seq={} account={} debit={} credit={}",
                    entry.getSequenceNumber(), entry.getAccountId(), entry.getDebit(), entry.getCredit()));
        }
        return written;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntriesForDocument(UUID businessId, DocumentType documentType, UUID documentId) {
        return ledgerRepository.findByDocument(businessId, documentType, documentId);
    }

    private void validate(PostingRequest request) {
        Objects.requireNonNull(request.getBusinessId(), "businessId must not be null");
        Objects.requireNonNull(request.getDocumentType(), "documentType must not be null");
        Objects.requireNonNull(request.getDocumentId(), "documentId must not be null");
        if (request.getTransactionDate() == null) {
            throw new ValidationException("Transaction date is required");
        }

        List<PostingLine> lines = request.getLines();
        if (lines == null || lines.size() < 2) {
            throw new ValidationException("A posting needs at least two lines");
        }
        for (PostingLine line : lines) {
            validateLine(line);
        }

        if (!request.isBalanced()) {
            throw new UnbalancedPostingException(request.getDebitTotal(), request.getCreditTotal());
        }

        validateAccounts(request.getBusinessId(), lines);
    }

    private void validateLine(PostingLine line) {
        if (line.getAccountId() == null) {
            throw new ValidationException("Every line needs an account");
        }
        BigDecimal debit = line.getDebit();
        BigDecimal credit = line.getCredit();
        if (Money.isNegative(debit) || Money.isNegative(credit)) {
            throw new ValidationException("Debit and credit amounts must not be negative");
        }
        if (!Money.fitsScale(debit) || !Money.fitsScale(credit)) {
            throw new ValidationException("Amounts must have at most " + Money.SCALE + " decimal places");
        }
        if (debit.signum() == 0 && credit.signum() == 0) {
            throw new ValidationException("Each line must carry a debit or a credit amount");
        }
    }

    private void validateAccounts(UUID businessId, List<PostingLine> lines) {
        Set<UUID> accountIds = lines.stream()
            .map(PostingLine::getAccountId)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<UUID, Account> accounts = accountRepository.findAllById(businessId, accountIds).stream()
            .collect(Collectors.toMap(Account::getId, Function.identity()));

        for (UUID accountId : accountIds) {
            Account account = accounts.get(accountId);
            if (account == null) {
                throw NotFoundException.of("Account", accountId);
            }
            if (!account.isActive()) {
                throw new ValidationException("Account " + account.getDisplayName() + " is inactive");
            }
        }
    }

    private LedgerEntry toEntry(PostingRequest request, PostingLine line) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .businessId(request.getBusinessId())
            .branchId(request.getBranchId())
            .accountId(line.getAccountId())
            .transactionDate(request.getTransactionDate())
            .description(line.getDescription() != null ? line.getDescription() : request.getDescription())
            .debit(Money.of(line.getDebit()))
            .credit(Money.of(line.getCredit()))
            .documentType(request.getDocumentType())
            .documentId(request.getDocumentId())
            .documentNumber(request.getDocumentNumber())
            .customerId(request.getCustomerId())
            .vendorId(request.getVendorId())
            .build();
    }
}
