package com.flagship.store_credit.code;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of redemption_codes.
 *
 * No setters: the only state change is {@link #markUsed}, and it happens once.
 */
@Entity
@Table(name = "redemption_codes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RedemptionCodeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false, unique = true, length = 16)
    private String code;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private Instant usedAt;

    @Column(name = "redeemed_transaction_id")
    private UUID redeemedTransactionId;

    static RedemptionCodeEntity fromDomain(RedemptionCode code) {
        return new RedemptionCodeEntity(
            code.getId(),
            code.getUserId(),
            code.getCode(),
            code.getAmount(),
            code.getCreatedAt(),
            code.getExpiresAt(),
            code.isUsed(),
            code.getUsedAt(),
            code.getRedeemedTransactionId()
        );
    }

    public RedemptionCode toDomain() {
        return new RedemptionCode(
            id,
            userId,
            code,
            amount,
            createdAt,
            expiresAt,
            used,
            usedAt,
            redeemedTransactionId
        );
    }

    void markUsed(Instant at, UUID transactionId) {
        if (this.used) {
            throw new IllegalStateException("Redemption code " + code + " is already used");
        }
        this.used = true;
        this.usedAt = at;
        this.redeemedTransactionId = transactionId;
    }
}
