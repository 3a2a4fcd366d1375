package com.flagship.erp_ledger.ledger;

import java.util.List;

/**
 * Callback invoked inside the posting transaction after entries have been written.
 * Implementations keep derived state (such as cached bank balances) in step with the ledger.
 */
public interface LedgerPostingListener {

    void onPosted(PostingRequest request, List<LedgerEntry> entries);
}
