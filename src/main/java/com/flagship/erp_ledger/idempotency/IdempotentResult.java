package com.flagship.erp_ledger.idempotency;

import lombok.Value;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Outcome of an idempotent call: the affected resource, and whether it came from an earlier request.
 */
@Value
public class IdempotentResult {
    UUID resourceId;
    boolean replayed;

    /**
     * 201 for a new resource, 200 when an earlier request is being replayed.
     */
    public HttpStatus responseStatus() {
        return replayed ? HttpStatus.OK : HttpStatus.CREATED;
    }
}
