package com.flagship.store_credit.ledger;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Calendar rules for credit expiry.
 *
 * A credit expires exactly {@code expiryMonths} calendar months after it was
 * created. Dates are evaluated in UTC and advanced with
 * {@link java.time.ZonedDateTime#plusMonths(long)}, so a credit issued on a day
 * the target month does not have (Jan 31, Feb 29) expires on the last day of
 * that month.
 */
@Value
public class ExpiryPolicy {

    // Month-end clamping can move an expiry date by up to three days.
    private static final Duration CANDIDATE_SLACK = Duration.ofDays(7);

    int expiryMonths;
    Duration expiringSoonWindow;

    public ExpiryPolicy(int expiryMonths, Duration expiringSoonWindow) {
        if (expiryMonths <= 0) {
            throw new IllegalArgumentException("Expiry window must be at least one month");
        }
        if (expiringSoonWindow == null || expiringSoonWindow.isNegative()) {
            throw new IllegalArgumentException("Expiring-soon window must be zero or positive");
        }
        this.expiryMonths = expiryMonths;
        this.expiringSoonWindow = expiringSoonWindow;
    }

    public Instant expiresAt(Instant createdAt) {
        return createdAt.atZone(ZoneOffset.UTC).plusMonths(expiryMonths).toInstant();
    }

    /**
     * A credit is expired from its expiry instant onwards.
     */
    public boolean isExpired(Instant createdAt, Instant asOf) {
        return !asOf.isBefore(expiresAt(createdAt));
    }

    public boolean isExpiringSoon(Instant createdAt, Instant asOf) {
        Instant expiresAt = expiresAt(createdAt);
        return asOf.isBefore(expiresAt) && !expiresAt.isAfter(asOf.plus(expiringSoonWindow));
    }

    /**
     * Latest creation time a credit can have and still be expired at {@code now}.
     * Errs on the late side; callers re-check every candidate precisely.
     */
    public Instant candidateCutoff(Instant now) {
        return now.atZone(ZoneOffset.UTC).minusMonths(expiryMonths).toInstant().plus(CANDIDATE_SLACK);
    }
}
