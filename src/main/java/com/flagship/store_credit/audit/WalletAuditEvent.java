package com.flagship.store_credit.audit;

import com.flagship.store_credit.ledger.CreditTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one wallet mutation.
 *
 * The ledger itself is the source of truth; this event exists for compliance
 * and operational visibility and may be lost without affecting balances.
 */
@Value
public class WalletAuditEvent {
    UUID eventId;
    AuditAction action;
    String actor;
    UUID targetUser;
    BigDecimal amount;
    String reference;
    UUID transactionId;
    BigDecimal balanceAfter;
    Instant occurredAt;
    String correlationId;

    public static WalletAuditEvent of(AuditAction action, CreditTransaction transaction,
                                      BigDecimal balanceAfter, String correlationId) {
        return new WalletAuditEvent(
            UUID.randomUUID(),
            action,
            transaction.getPerformedBy(),
            transaction.getUserId(),
            transaction.getAmount(),
            transaction.getReference(),
            transaction.getId(),
            balanceAfter,
            transaction.getCreatedAt(),
            correlationId
        );
    }
}
