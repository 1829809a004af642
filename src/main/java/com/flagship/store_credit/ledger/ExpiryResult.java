package com.flagship.store_credit.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Expiry debits written for one user in one pass.
 */
@Value
public class ExpiryResult {
    UUID userId;
    List<CreditTransaction> debits;
    BigDecimal balanceAfter;

    public static ExpiryResult none(UUID userId) {
        return new ExpiryResult(userId, List.of(), null);
    }

    public BigDecimal getTotalExpired() {
        return debits.stream()
                .map(CreditTransaction::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isEmpty() {
        return debits.isEmpty();
    }
}
