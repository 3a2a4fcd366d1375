package com.flagship.erp_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Request-scoped correlation data, mirrored into the SLF4J MDC so every log line carries it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String BUSINESS_ID_MDC_KEY = "businessId";
    public static final String DOCUMENT_ID_MDC_KEY = "documentId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId.get());
    }

    public static void setBusinessId(String businessId) {
        if (businessId != null && !businessId.isBlank()) {
            MDC.put(BUSINESS_ID_MDC_KEY, businessId);
        }
    }

    /**
     * Tags subsequent log lines of this request with the document being worked on.
     */
    public static void setDocumentId(UUID documentId) {
        if (documentId != null) {
            MDC.put(DOCUMENT_ID_MDC_KEY, documentId.toString());
        }
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(BUSINESS_ID_MDC_KEY);
        MDC.remove(DOCUMENT_ID_MDC_KEY);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
