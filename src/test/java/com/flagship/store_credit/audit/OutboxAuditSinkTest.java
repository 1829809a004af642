package com.flagship.store_credit.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.store_credit.config.JacksonConfig;
import com.flagship.store_credit.ledger.CreditTransaction;
import com.flagship.store_credit.ledger.TransactionKind;
import com.flagship.store_credit.ledger.TransactionReason;
import com.flagship.store_credit.outbox.OutboxService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxAuditSinkTest {

    @Mock
    private OutboxService outboxService;

    @InjectMocks
    private OutboxAuditSink sink;

    private final UUID user = UUID.randomUUID();

    @Test
    @DisplayName("Audit events are queued in the outbox under the wallet aggregate and correlation id")
    void queuesEventForUser() {
        WalletAuditEvent event = event(AuditAction.CREDIT_REDEEMED);

        sink.record(event);

        verify(outboxService).saveEvent("Wallet", user, "credit_redeemed", "corr-1", event);
    }

    @Test
    @DisplayName("Outbox failures reach the caller, which decides how to report audit loss")
    void propagatesOutboxFailure() {
        when(outboxService.saveEvent(anyString(), eq(user), anyString(), anyString(), any()))
                .thenThrow(new IllegalStateException("database down"));

        assertThrows(IllegalStateException.class, () -> sink.record(event(AuditAction.CREDIT_ISSUED)));
    }

    @Test
    @DisplayName("Payload carries the wire action name, ISO timestamps and plain amounts")
    void serialisedPayload() throws Exception {
        ObjectMapper mapper = new JacksonConfig().objectMapper();

        String payload = mapper.writeValueAsString(event(AuditAction.CREDIT_EXPIRED));
        JsonNode json = mapper.readTree(payload);

        assertEquals("credit_expired", json.get("action").asText());
        assertEquals("2025-03-01T09:00:00Z", json.get("occurredAt").asText());
        assertTrue(payload.contains("\"amount\":12.50"), payload);
        assertEquals(user.toString(), json.get("targetUser").asText());
        assertEquals("admin@shop", json.get("actor").asText());
        assertEquals("corr-1", json.get("correlationId").asText());
    }

    private WalletAuditEvent event(AuditAction action) {
        CreditTransaction tx = new CreditTransaction(UUID.randomUUID(), user, TransactionKind.DEBIT,
                TransactionReason.REDEMPTION, new BigDecimal("12.50"), "order-1", null, "admin@shop",
                Instant.parse("2025-03-01T09:00:00Z"), null, 7L);
        return WalletAuditEvent.of(action, tx, new BigDecimal("87.50"), "corr-1");
    }
}
