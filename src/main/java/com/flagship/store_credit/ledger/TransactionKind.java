package com.flagship.store_credit.ledger;

/**
 * Direction of a wallet ledger entry.
 * Amounts are always positive; the kind alone decides whether an entry
 * adds to or removes from a user's spendable balance.
 */
public enum TransactionKind {
    CREDIT,
    DEBIT
}
