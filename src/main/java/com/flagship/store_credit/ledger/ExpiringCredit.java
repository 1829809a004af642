package com.flagship.store_credit.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Unspent part of a credit that expires within the look-ahead window.
 */
@Value
public class ExpiringCredit {
    UUID creditId;
    BigDecimal amount;
    Instant expiresAt;
}
