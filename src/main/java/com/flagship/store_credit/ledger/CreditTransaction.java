package com.flagship.store_credit.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable wallet ledger entry.
 *
 * Key invariants:
 * - Entries are append-only, never updated or deleted
 * - amount is strictly positive, direction is carried by kind
 * - for a CREDIT, createdAt starts the expiry clock
 *
 * sequenceNumber is assigned by the store and breaks ties between entries
 * written at the same instant. It is null until the entry is appended.
 */
@Value
public class CreditTransaction {
    UUID id;
    UUID userId;
    TransactionKind kind;
    TransactionReason reason;
    BigDecimal amount;
    String reference;
    String notes;
    String performedBy;
    Instant createdAt;
    UUID sourceTransactionId;
    Long sequenceNumber;

    /**
     * Creates a new, not yet persisted entry.
     */
    public static CreditTransaction create(UUID userId, TransactionKind kind, TransactionReason reason,
                                           BigDecimal amount, String reference, String notes,
                                           String performedBy, Instant createdAt, UUID sourceTransactionId) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(createdAt, "createdAt");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Transaction amount must be positive");
        }
        return new CreditTransaction(
            UUID.randomUUID(),
            userId,
            kind,
            reason,
            amount,
            reference,
            notes,
            performedBy,
            createdAt,
            sourceTransactionId,
            null // assigned by the store
        );
    }

    /**
     * Returns a copy carrying the store-assigned sequence number.
     */
    public CreditTransaction withSequenceNumber(long sequenceNumber) {
        return new CreditTransaction(
            this.id,
            this.userId,
            this.kind,
            this.reason,
            this.amount,
            this.reference,
            this.notes,
            this.performedBy,
            this.createdAt,
            this.sourceTransactionId,
            sequenceNumber
        );
    }

    public boolean isCredit() {
        return kind == TransactionKind.CREDIT;
    }

    public boolean isDebit() {
        return kind == TransactionKind.DEBIT;
    }
}
