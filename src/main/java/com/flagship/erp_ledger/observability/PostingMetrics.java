package com.flagship.erp_ledger.observability;

import com.flagship.erp_ledger.common.DocumentType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for ledger postings and the idempotency layer.
 *
 * <ul>
 *   <li>{@code ledger.postings} counter tagged by document type</li>
 *   <li>{@code ledger.postings.rejected} counter tagged by document type and error code</li>
 *   <li>{@code ledger.posting.latency} timer tagged by document type</li>
 *   <li>{@code ledger.entries.written} counter of individual entries</li>
 *   <li>{@code idempotency.cache} counter tagged by hit/miss</li>
 * </ul>
 */
@Component
public class PostingMetrics {

    private final MeterRegistry registry;
    private final Counter entriesWritten;

    public PostingMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.entriesWritten = Counter.builder("ledger.entries.written")
                .description("Number of ledger entries written")
                .register(registry);
    }

    public void recordPosting(DocumentType documentType, int entryCount, long durationMs) {
        String type = tagOf(documentType);
        registry.counter("ledger.postings", "document_type", type).increment();
        registry.timer("ledger.posting.latency", "document_type", type)
                .record(Duration.ofMillis(durationMs));
        entriesWritten.increment(entryCount);
    }

    public void recordPostingRejected(DocumentType documentType, String reason) {
        registry.counter("ledger.postings.rejected",
                "document_type", tagOf(documentType),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordIdempotencyHit(String operation) {
        registry.counter("idempotency.cache", "result", "hit", "operation", sanitizeTag(operation)).increment();
    }

    public void recordIdempotencyMiss(String operation) {
        registry.counter("idempotency.cache", "result", "miss", "operation", sanitizeTag(operation)).increment();
    }

    private String tagOf(DocumentType documentType) {
        return documentType == null ? "unknown" : documentType.name().toLowerCase();
    }

    /**
     * Keeps tag values bounded and Prometheus-safe.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
