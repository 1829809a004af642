package com.flagship.store_credit.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of a mutating wallet operation.
 *
 * Business failures are statuses, not exceptions, because callers such as
 * checkout have to branch on them. {@code balance} is the spendable balance
 * after the operation; for {@link Status#INSUFFICIENT_BALANCE} it is the
 * amount that was available.
 */
@Value
public class LedgerOutcome {

    public enum Status {
        APPLIED,
        /** Idempotency hit: {@code transaction} is the entry written by the first call. */
        DUPLICATE,
        INVALID_AMOUNT,
        INSUFFICIENT_BALANCE,
        NOT_FOUND,
        NOT_REVERSIBLE
    }

    Status status;
    CreditTransaction transaction;
    BigDecimal balance;
    String message;

    public static LedgerOutcome applied(CreditTransaction transaction, BigDecimal balance) {
        return new LedgerOutcome(Status.APPLIED, transaction, balance, null);
    }

    public static LedgerOutcome duplicate(CreditTransaction prior, BigDecimal balance) {
        return new LedgerOutcome(Status.DUPLICATE, prior, balance,
                "Already applied as transaction " + prior.getId());
    }

    public static LedgerOutcome invalidAmount(String message) {
        return new LedgerOutcome(Status.INVALID_AMOUNT, null, null, message);
    }

    public static LedgerOutcome insufficientBalance(BigDecimal available, BigDecimal requested) {
        return new LedgerOutcome(Status.INSUFFICIENT_BALANCE, null, available,
                String.format("Requested %s but only %s is available", requested.toPlainString(),
                        available.toPlainString()));
    }

    public static LedgerOutcome notFound(String message) {
        return new LedgerOutcome(Status.NOT_FOUND, null, null, message);
    }

    public static LedgerOutcome notReversible(CreditTransaction transaction, String message) {
        return new LedgerOutcome(Status.NOT_REVERSIBLE, transaction, null, message);
    }

    /**
     * True when the requested effect is in the ledger, whether written now or
     * by an earlier call with the same reference.
     */
    public boolean isSuccessful() {
        return status == Status.APPLIED || status == Status.DUPLICATE;
    }
}
