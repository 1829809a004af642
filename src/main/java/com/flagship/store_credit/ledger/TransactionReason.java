package com.flagship.store_credit.ledger;

/**
 * Why a ledger entry was written.
 *
 * ISSUE and REDEMPTION entries carry the caller's idempotency reference.
 * EXPIRY and REVERSAL entries always point at the transaction they
 * neutralise through sourceTransactionId.
 */
public enum TransactionReason {
    ISSUE,
    REDEMPTION,
    EXPIRY,
    REVERSAL
}
