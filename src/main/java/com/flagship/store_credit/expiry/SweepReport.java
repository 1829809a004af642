package com.flagship.store_credit.expiry;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one expiry sweep, for operators.
 */
@Value
public class SweepReport {
    String sweepId;
    int usersScanned;
    int usersWithExpiry;
    int debitsCreated;
    BigDecimal totalExpired;
    List<SweepFailure> failures;
    Duration duration;

    @Value
    public static class SweepFailure {
        UUID userId;
        String errorType;
        String message;
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
