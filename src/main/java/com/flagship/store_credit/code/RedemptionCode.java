package com.flagship.store_credit.code;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One-time code a customer shows at a physical store to spend a fixed
 * amount of store credit. The wallet is only debited when the code is
 * redeemed.
 */
@Value
public class RedemptionCode {
    UUID id;
    UUID userId;
    String code;
    BigDecimal amount;
    Instant createdAt;
    Instant expiresAt;
    boolean used;
    Instant usedAt;
    UUID redeemedTransactionId;

    public static RedemptionCode create(UUID userId, String code, BigDecimal amount,
                                        Instant createdAt, Duration ttl) {
        return new RedemptionCode(
            UUID.randomUUID(),
            userId,
            code,
            amount,
            createdAt,
            createdAt.plus(ttl),
            false,
            null,
            null
        );
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
