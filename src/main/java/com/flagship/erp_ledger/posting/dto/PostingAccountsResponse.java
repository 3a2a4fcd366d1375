package com.flagship.erp_ledger.posting.dto;

import com.flagship.erp_ledger.posting.PostingAccounts;
import com.flagship.erp_ledger.posting.WellKnownAccount;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

@Value
public class PostingAccountsResponse {
    Map<WellKnownAccount, UUID> mappings;
    List<WellKnownAccount> unmapped;
    boolean complete;

    public static PostingAccountsResponse from(PostingAccounts accounts) {
        List<WellKnownAccount> unmapped = Stream.of(WellKnownAccount.values())
            .filter(role -> accounts.find(role).isEmpty())
            .toList();
        return new PostingAccountsResponse(new EnumMap<>(accounts.asMap()), unmapped, accounts.isComplete());
    }
}
