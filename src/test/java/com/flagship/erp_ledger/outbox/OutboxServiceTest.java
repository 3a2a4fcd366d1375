package com.flagship.erp_ledger.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.erp_ledger.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxServiceTest {

    @Mock
    private OutboxEventRepository repository;

    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new JacksonConfig().objectMapper();
        outboxService = new OutboxService(repository, objectMapper);
    }

    @Test
    @DisplayName("Saved event carries the snake_case payload and starts unpublished")
    void savesSerializedPayload() {
        // Given
        UUID documentId = UUID.randomUUID();
        when(repository.save(any(OutboxEventEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        OutboxEvent event = outboxService.saveEvent("SALES_INVOICE", documentId, "LedgerPosted",
            Map.of("documentNumber", "INV-00001", "transactionDate", LocalDate.of(2024, 3, 1),
                "totalAmount", new BigDecimal("215.00")));

        // Then
        ArgumentCaptor<OutboxEventEntity> saved = ArgumentCaptor.forClass(OutboxEventEntity.class);
        verify(repository).save(saved.capture());
        assertEquals("SALES_INVOICE", saved.getValue().getAggregateType());
        assertEquals(documentId, event.getAggregateId());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        assertTrue(event.getPayload().contains("\"2024-03-01\""));
        assertTrue(event.getPayload().contains("INV-00001"));
    }

    @Test
    @DisplayName("Unserializable payload is refused before saving")
    void unserializablePayload() {
        Object unserializable = new Object() {
            @SuppressWarnings("unused")
            public Object getSelf() {
                return this;
            }
        };

        assertThrows(IllegalArgumentException.class,
            () -> outboxService.saveEvent("JOURNAL_VOUCHER", UUID.randomUUID(), "LedgerPosted", unserializable));
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("Marking an event failed counts the retry and keeps the error")
    void markFailedCountsRetry() {
        // Given
        OutboxEventEntity entity = OutboxEventEntity.fromDomain(
            OutboxEvent.create("FUND_TRANSFER", UUID.randomUUID(), "LedgerPosted", "{}"));
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));

        // When
        outboxService.markFailed(entity.getId(), "timeout");
        outboxService.markFailed(entity.getId(), "timeout again");

        // Then
        OutboxEvent event = entity.toDomain();
        assertEquals(2, event.getRetryCount());
        assertEquals("timeout again", event.getLastError());
        assertTrue(event.isDeadLetter(2));
    }

    @Test
    @DisplayName("Publishing clears the last error")
    void markPublishedClearsError() {
        OutboxEventEntity entity = OutboxEventEntity.fromDomain(
            OutboxEvent.create("FUND_TRANSFER", UUID.randomUUID(), "LedgerPosted", "{}"));
        entity.markFailed("timeout");
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));

        outboxService.markPublished(entity.getId());

        OutboxEvent event = entity.toDomain();
        assertTrue(event.isPublished());
        assertNull(event.getLastError());
        assertFalse(event.isDeadLetter(1));
    }
}
