package com.flagship.erp_ledger.banking;

import com.flagship.erp_ledger.ledger.LedgerEntry;
import com.flagship.erp_ledger.ledger.LedgerPostingListener;
import com.flagship.erp_ledger.ledger.PostingRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Keeps {@code bank_accounts.current_balance} equal to the raw ledger balance of the linked chart account.
 *
 * Runs inside the posting transaction, so the ledger and the bank balance can never disagree after commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BankBalanceSynchronizer implements LedgerPostingListener {

    private final BankAccountRepository bankAccountRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void onPosted(PostingRequest request, List<LedgerEntry> entries) {
        Map<UUID, BigDecimal> netByAccount = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            netByAccount.merge(entry.getAccountId(), entry.getNet(), BigDecimal::add);
        }

        List<BankAccount> linked = bankAccountRepository.findLinkedForUpdate(request.getBusinessId(), netByAccount.keySet());
        for (BankAccount bankAccount : linked) {
            BigDecimal net = netByAccount.get(bankAccount.getChartAccountId());
            bankAccount.applyLedgerMovement(net);
            log.debug("Bank account {} moved by {} to {} ({} {})", bankAccount.getAccountName(), net,
                    bankAccount.getCurrentBalance(), request.getDocumentType(), request.getDocumentNumber());
        }
    }
}
