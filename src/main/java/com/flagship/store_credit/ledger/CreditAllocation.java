package com.flagship.store_credit.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * How much of one credit is still unspent at a point in time, after FIFO
 * attribution of every debit up to that point.
 */
@Value
public class CreditAllocation {
    CreditTransaction credit;
    BigDecimal remaining;
    BigDecimal forfeited;
    Instant expiresAt;
    boolean expired;

    public UUID getCreditId() {
        return credit.getId();
    }

    /**
     * Remaining amount that the expiry sweep still has to materialise.
     */
    public boolean hasForfeitableRemainder() {
        return expired && remaining.signum() > 0;
    }

    public CreditState getState() {
        if (expired && (remaining.signum() > 0 || forfeited.signum() > 0)) {
            return CreditState.EXPIRED;
        }
        if (remaining.signum() == 0) {
            return CreditState.FULLY_REDEEMED;
        }
        if (remaining.compareTo(credit.getAmount()) < 0) {
            return CreditState.PARTIALLY_REDEEMED;
        }
        return CreditState.ACTIVE;
    }
}
