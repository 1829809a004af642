package com.flagship.store_credit.ledger;

/**
 * Derived lifecycle of a credit. Never stored.
 *
 * ACTIVE -> PARTIALLY_REDEEMED -> FULLY_REDEEMED | EXPIRED
 */
public enum CreditState {
    ACTIVE,
    PARTIALLY_REDEEMED,
    FULLY_REDEEMED,
    EXPIRED
}
