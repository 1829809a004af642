package com.flagship.store_credit.ledger;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Derives wallet balances by folding over a user's transactions.
 *
 * The fold walks entries in (createdAt, sequenceNumber) order:
 * - every CREDIT opens a slot holding its full amount
 * - a DEBIT that names a source credit (expiry, reversal) drains that credit first
 * - everything else drains the oldest credit still alive at the debit's time (FIFO)
 *
 * Pure and deterministic: no store access, no clock. The caller supplies
 * the point in time.
 */
@Component
public class BalanceCalculator {

    static final Comparator<CreditTransaction> CHRONOLOGICAL = Comparator
        .comparing(CreditTransaction::getCreatedAt)
        .thenComparing(tx -> tx.getSequenceNumber() == null ? Long.MAX_VALUE : tx.getSequenceNumber());

    private final ExpiryPolicy expiryPolicy;

    public BalanceCalculator(ExpiryPolicy expiryPolicy) {
        this.expiryPolicy = expiryPolicy;
    }

    public ExpiryPolicy expiryPolicy() {
        return expiryPolicy;
    }

    /**
     * Computes the spendable balance and the credits expiring soon.
     *
     * @param transactions all transactions of one user, in any order
     * @param asOf point in time to evaluate; later entries are ignored
     */
    public WalletBalance compute(List<CreditTransaction> transactions, Instant asOf) {
        Fold fold = fold(transactions, asOf);

        BigDecimal live = BigDecimal.ZERO;
        List<ExpiringCredit> expiringSoon = new ArrayList<>();
        for (CreditSlot slot : fold.slots.values()) {
            if (slot.isExpiredAt(asOf) || slot.remaining.signum() == 0) {
                continue;
            }
            live = live.add(slot.remaining);
            if (expiryPolicy.isExpiringSoon(slot.credit.getCreatedAt(), asOf)) {
                expiringSoon.add(new ExpiringCredit(slot.credit.getId(), slot.remaining, slot.expiresAt));
            }
        }
        expiringSoon.sort(Comparator.comparing(ExpiringCredit::getExpiresAt));

        BigDecimal balance = live.subtract(fold.unattributed);
        if (balance.signum() < 0) {
            balance = BigDecimal.ZERO;
        }
        return new WalletBalance(balance, List.copyOf(expiringSoon), asOf);
    }

    /**
     * Per-credit view of the same fold, oldest credit first.
     */
    public List<CreditAllocation> allocate(List<CreditTransaction> transactions, Instant asOf) {
        Fold fold = fold(transactions, asOf);
        List<CreditAllocation> allocations = new ArrayList<>(fold.slots.size());
        for (CreditSlot slot : fold.slots.values()) {
            allocations.add(new CreditAllocation(
                slot.credit,
                slot.remaining,
                slot.forfeited,
                slot.expiresAt,
                slot.isExpiredAt(asOf)
            ));
        }
        return allocations;
    }

    /**
     * Debit amount that could not be matched to any live credit.
     * Non-zero only for ledgers written outside the balance checks.
     */
    public BigDecimal unattributedDebits(List<CreditTransaction> transactions, Instant asOf) {
        return fold(transactions, asOf).unattributed;
    }

    private Fold fold(List<CreditTransaction> transactions, Instant asOf) {
        List<CreditTransaction> ordered = transactions.stream()
            .filter(tx -> !tx.getCreatedAt().isAfter(asOf))
            .sorted(CHRONOLOGICAL)
            .toList();

        Fold fold = new Fold();
        for (CreditTransaction tx : ordered) {
            switch (tx.getKind()) {
                case CREDIT -> fold.slots.put(tx.getId(), new CreditSlot(tx, expiryPolicy.expiresAt(tx.getCreatedAt())));
                case DEBIT -> fold.unattributed = fold.unattributed.add(applyDebit(fold.slots, tx));
            }
        }
        return fold;
    }

    /**
     * Attributes one debit to credits and returns whatever could not be attributed.
     */
    private BigDecimal applyDebit(Map<UUID, CreditSlot> slots, CreditTransaction debit) {
        BigDecimal outstanding = debit.getAmount();
        boolean forfeiture = debit.getReason() == TransactionReason.EXPIRY;

        CreditSlot source = debit.getSourceTransactionId() == null
            ? null
            : slots.get(debit.getSourceTransactionId());
        if (source != null) {
            outstanding = source.drain(outstanding, forfeiture);
        }

        for (CreditSlot slot : slots.values()) {
            if (outstanding.signum() == 0) {
                break;
            }
            if (slot.remaining.signum() > 0 && !slot.isExpiredAt(debit.getCreatedAt())) {
                outstanding = slot.drain(outstanding, forfeiture);
            }
        }
        return outstanding;
    }

    private static final class Fold {
        // insertion order == chronological order of credits
        private final Map<UUID, CreditSlot> slots = new LinkedHashMap<>();
        private BigDecimal unattributed = BigDecimal.ZERO;
    }

    private static final class CreditSlot {
        private final CreditTransaction credit;
        private final Instant expiresAt;
        private BigDecimal remaining;
        private BigDecimal forfeited = BigDecimal.ZERO;

        private CreditSlot(CreditTransaction credit, Instant expiresAt) {
            this.credit = credit;
            this.expiresAt = expiresAt;
            this.remaining = credit.getAmount();
        }

        private boolean isExpiredAt(Instant instant) {
            return !instant.isBefore(expiresAt);
        }

        /**
         * Takes up to {@code amount} from this credit and returns the rest.
         */
        private BigDecimal drain(BigDecimal amount, boolean forfeiture) {
            BigDecimal taken = amount.min(remaining);
            remaining = remaining.subtract(taken);
            if (forfeiture) {
                forfeited = forfeited.add(taken);
            }
            return amount.subtract(taken);
        }
    }
}
