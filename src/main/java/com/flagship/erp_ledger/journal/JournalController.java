package com.flagship.erp_ledger.journal;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.idempotency.IdempotencyService;
import com.flagship.erp_ledger.idempotency.IdempotentOperation;
import com.flagship.erp_ledger.idempotency.IdempotentResult;
import com.flagship.erp_ledger.journal.dto.CreateJournalVoucherRequest;
import com.flagship.erp_ledger.journal.dto.JournalVoucherResponse;
import com.flagship.erp_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/journal-vouchers")
@RequiredArgsConstructor
public class JournalController {

    private final JournalService journalService;
    private final IdempotencyService idempotencyService;

    /**
     * Creates a voucher. Requires an Idempotency-Key; a replayed key returns the original voucher with 200.
     */
    @PostMapping
    public ResponseEntity<JournalVoucherResponse> create(TenantScope scope,
                                                         @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                         @Valid @RequestBody CreateJournalVoucherRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey,
            IdempotentOperation.CREATE_JOURNAL_VOUCHER, () -> journalService.create(scope, request).getId());
        CorrelationContext.setDocumentId(result.getResourceId());
        return ResponseEntity.status(result.responseStatus()).body(load(scope, result.getResourceId()));
    }

    @GetMapping
    public List<JournalVoucherResponse> list(TenantScope scope) {
        return journalService.list(scope).stream()
            .map(voucher -> JournalVoucherResponse.from(voucher, List.of()))
            .toList();
    }

    @GetMapping("/{id}")
    public JournalVoucherResponse get(TenantScope scope, @PathVariable("id") UUID id) {
        return load(scope, id);
    }

    @PostMapping("/{id}/post")
    public JournalVoucherResponse post(TenantScope scope, @PathVariable("id") UUID id) {
        journalService.post(scope, id);
        return load(scope, id);
    }

    private JournalVoucherResponse load(TenantScope scope, UUID id) {
        return JournalVoucherResponse.from(journalService.get(scope, id), journalService.getLines(scope, id));
    }
}
