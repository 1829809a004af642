package com.flagship.store_credit.ledger;

import com.flagship.store_credit.audit.AuditAction;
import com.flagship.store_credit.audit.AuditSink;
import com.flagship.store_credit.audit.WalletAuditEvent;
import com.flagship.store_credit.observability.CorrelationContext;
import com.flagship.store_credit.observability.WalletMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Public operations on store-credit wallets.
 *
 * Every mutation runs as one atomic unit under the user's lock
 * ({@link TransactionStore#inUserTransaction}): the idempotency check, the
 * balance check and the append see the same ledger state, so two concurrent
 * redemptions can never both spend the same credit. Reads take no lock.
 *
 * Audit events are emitted after the unit has committed. A failing audit
 * sink is logged as audit loss and never fails the operation.
 */
@Service
@Slf4j
public class LedgerService {

    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int MAX_HISTORY_LIMIT = 100;

    static final String EXPIRY_REFERENCE = "expired";
    static final String EXPIRY_ACTOR = "system:expiry-sweep";
    static final String REVERSAL_REFERENCE_PREFIX = "reversal:";

    private final TransactionStore store;
    private final BalanceCalculator calculator;
    private final AuditSink auditSink;
    private final WalletMetrics metrics;
    private final Clock clock;
    private final int currencyScale;

    public LedgerService(TransactionStore store,
                         BalanceCalculator calculator,
                         AuditSink auditSink,
                         WalletMetrics metrics,
                         Clock clock,
                         @Value("${wallet.currency-scale:2}") int currencyScale) {
        this.store = store;
        this.calculator = calculator;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.clock = clock;
        this.currencyScale = currencyScale;
    }

    /**
     * Adds credit to a wallet. The ledger enforces no upper bound.
     *
     * @param reference idempotency key; a second call with the same reference
     *                  returns the first credit as {@link LedgerOutcome.Status#DUPLICATE}
     */
    public LedgerOutcome issue(UUID userId, BigDecimal amount, String reference,
                               String notes, String performedBy) {
        Objects.requireNonNull(userId, "userId");
        return execute("issue", userId, () -> {
            Optional<BigDecimal> normalized = normalizeAmount(amount);
            if (normalized.isEmpty()) {
                return LedgerOutcome.invalidAmount(invalidAmountMessage(amount));
            }

            LedgerOutcome outcome = store.inUserTransaction(userId, () -> {
                List<CreditTransaction> history = store.listAllByUser(userId);
                Instant asOf = effectiveNow(history);

                Optional<CreditTransaction> prior = findPrior(userId, TransactionKind.CREDIT,
                        TransactionReason.ISSUE, reference);
                if (prior.isPresent()) {
                    warnOnMismatch(prior.get(), normalized.get());
                    return LedgerOutcome.duplicate(prior.get(), balanceOf(history, asOf));
                }

                CreditTransaction credit = store.append(CreditTransaction.create(
                        userId, TransactionKind.CREDIT, TransactionReason.ISSUE, normalized.get(),
                        reference, notes, performedBy, asOf, null));
                return LedgerOutcome.applied(credit, balanceOf(with(history, credit), asOf));
            });

            if (outcome.getStatus() == LedgerOutcome.Status.APPLIED) {
                log.info("Issued {} store credit to user {} (reference={}, by={}), balance now {}",
                        outcome.getTransaction().getAmount(), userId, reference, performedBy, outcome.getBalance());
                emit(AuditAction.CREDIT_ISSUED, outcome.getTransaction(), outcome.getBalance());
            } else {
                log.info("Duplicate issue for user {} with reference {}, returning transaction {}",
                        userId, reference, outcome.getTransaction().getId());
            }
            return outcome;
        });
    }

    /**
     * Spends credit. Writes a single debit for the full amount; attribution to
     * individual credits (oldest first) happens when balances are computed.
     *
     * @param reference idempotency key, normally the order reference
     */
    public LedgerOutcome redeem(UUID userId, BigDecimal amount, String reference,
                                String notes, String performedBy) {
        Objects.requireNonNull(userId, "userId");
        return execute("redeem", userId, () -> {
            Optional<BigDecimal> normalized = normalizeAmount(amount);
            if (normalized.isEmpty()) {
                return LedgerOutcome.invalidAmount(invalidAmountMessage(amount));
            }

            LedgerOutcome outcome = store.inUserTransaction(userId, () -> {
                List<CreditTransaction> history = store.listAllByUser(userId);
                Instant asOf = effectiveNow(history);

                Optional<CreditTransaction> prior = findPrior(userId, TransactionKind.DEBIT,
                        TransactionReason.REDEMPTION, reference);
                if (prior.isPresent()) {
                    warnOnMismatch(prior.get(), normalized.get());
                    return LedgerOutcome.duplicate(prior.get(), balanceOf(history, asOf));
                }

                BigDecimal available = balanceOf(history, asOf);
                if (normalized.get().compareTo(available) > 0) {
                    return LedgerOutcome.insufficientBalance(available, normalized.get());
                }

                CreditTransaction debit = store.append(CreditTransaction.create(
                        userId, TransactionKind.DEBIT, TransactionReason.REDEMPTION, normalized.get(),
                        reference, notes, performedBy, asOf, null));
                return LedgerOutcome.applied(debit, balanceOf(with(history, debit), asOf));
            });

            switch (outcome.getStatus()) {
                case APPLIED -> {
                    log.info("Redeemed {} store credit for user {} (reference={}), balance now {}",
                            outcome.getTransaction().getAmount(), userId, reference, outcome.getBalance());
                    emit(AuditAction.CREDIT_REDEEMED, outcome.getTransaction(), outcome.getBalance());
                }
                case INSUFFICIENT_BALANCE -> log.warn("Redemption of {} for user {} rejected: {}",
                        normalized.get(), userId, outcome.getMessage());
                default -> log.info("Duplicate redemption for user {} with reference {}, returning transaction {}",
                        userId, reference, outcome.getTransaction().getId());
            }
            return outcome;
        });
    }

    /**
     * Current spendable balance and the credits expiring within the look-ahead window.
     */
    public WalletBalance getBalance(UUID userId) {
        Objects.requireNonNull(userId, "userId");
        return execute("balance", userId, () -> {
            Instant now = now();
            List<CreditTransaction> history = store.listAllByUser(userId);
            return history.isEmpty() ? WalletBalance.empty(now) : calculator.compute(history, now);
        });
    }

    /**
     * Per-credit breakdown as of now, oldest credit first.
     */
    public List<CreditAllocation> getCreditAllocations(UUID userId) {
        Objects.requireNonNull(userId, "userId");
        return execute("allocations", userId,
                () -> calculator.allocate(store.listAllByUser(userId), now()));
    }

    public List<CreditTransaction> getTransactions(UUID userId) {
        return getTransactions(userId, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Transaction history, newest first. {@code limit} is clamped to [1, 100].
     */
    public List<CreditTransaction> getTransactions(UUID userId, int limit) {
        Objects.requireNonNull(userId, "userId");
        int clamped = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return execute("history", userId, () -> store.listByUser(userId, clamped));
    }

    /**
     * Appends a compensating entry of the opposite kind for the same amount.
     *
     * Reversing a credit writes a debit aimed at that credit and is refused
     * when the wallet cannot cover it, or once the credit has expired: its
     * remainder already belongs to the expiry debit, whether or not the sweep
     * has written it yet. Reversing a debit writes a new credit whose expiry
     * clock starts now. Reversal entries cannot be reversed, and each
     * transaction is reversed at most once.
     */
    public LedgerOutcome reverse(UUID transactionId, String performedBy, String notes) {
        Objects.requireNonNull(transactionId, "transactionId");
        return execute("reverse", null, () -> {
            Optional<CreditTransaction> original = store.findById(transactionId);
            if (original.isEmpty()) {
                log.warn("Reversal requested for unknown transaction {}", transactionId);
                return LedgerOutcome.notFound("Transaction " + transactionId + " does not exist");
            }

            CreditTransaction target = original.get();
            UUID userId = target.getUserId();
            MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId.toString());
            if (target.getReason() == TransactionReason.REVERSAL) {
                return LedgerOutcome.notReversible(target, "Reversal entries cannot be reversed");
            }

            LedgerOutcome outcome = store.inUserTransaction(userId, () -> {
                List<CreditTransaction> history = store.listAllByUser(userId);
                Instant asOf = effectiveNow(history);

                List<CreditTransaction> prior = store.findBySource(transactionId, TransactionReason.REVERSAL);
                if (!prior.isEmpty()) {
                    return LedgerOutcome.duplicate(prior.get(0), balanceOf(history, asOf));
                }

                if (target.isCredit() && calculator.expiryPolicy().isExpired(target.getCreatedAt(), asOf)) {
                    return LedgerOutcome.notReversible(target, "Credit expired at "
                            + calculator.expiryPolicy().expiresAt(target.getCreatedAt()));
                }

                TransactionKind kind = target.isCredit() ? TransactionKind.DEBIT : TransactionKind.CREDIT;
                CreditTransaction compensation = CreditTransaction.create(
                        userId, kind, TransactionReason.REVERSAL, target.getAmount(),
                        REVERSAL_REFERENCE_PREFIX + transactionId, notes, performedBy, asOf, transactionId);

                if (target.isCredit()) {
                    BigDecimal unattributedBefore = calculator.unattributedDebits(history, asOf);
                    BigDecimal unattributedAfter = calculator.unattributedDebits(with(history, compensation), asOf);
                    if (unattributedAfter.compareTo(unattributedBefore) > 0) {
                        return LedgerOutcome.insufficientBalance(balanceOf(history, asOf), target.getAmount());
                    }
                }

                CreditTransaction stored = store.append(compensation);
                return LedgerOutcome.applied(stored, balanceOf(with(history, stored), asOf));
            });

            switch (outcome.getStatus()) {
                case APPLIED -> {
                    log.info("Reversed {} {} of user {} with transaction {} (by={}), balance now {}",
                            target.getKind(), transactionId, userId, outcome.getTransaction().getId(),
                            performedBy, outcome.getBalance());
                    emit(AuditAction.TRANSACTION_REVERSED, outcome.getTransaction(), outcome.getBalance());
                }
                case INSUFFICIENT_BALANCE -> log.warn("Reversal of credit {} for user {} rejected: {}",
                        transactionId, userId, outcome.getMessage());
                case NOT_REVERSIBLE -> log.warn("Reversal of {} for user {} refused: {}",
                        transactionId, userId, outcome.getMessage());
                default -> log.info("Transaction {} already reversed by {}",
                        transactionId, outcome.getTransaction().getId());
            }
            return outcome;
        });
    }

    /**
     * Writes an expiry debit for the unspent remainder of every credit that
     * has expired, at most one per credit. Used by the expiry sweep.
     */
    public ExpiryResult expireCredits(UUID userId) {
        Objects.requireNonNull(userId, "userId");
        return execute("expire", userId, () -> {
            ExpiryPolicy policy = calculator.expiryPolicy();
            Instant now = now();
            boolean anyExpired = store.listCreditsByUser(userId).stream()
                    .anyMatch(credit -> policy.isExpired(credit.getCreatedAt(), now));
            if (!anyExpired) {
                return ExpiryResult.none(userId);
            }

            ExpiryResult result = store.inUserTransaction(userId, () -> {
                List<CreditTransaction> history = new ArrayList<>(store.listAllByUser(userId));
                Instant asOf = effectiveNow(history);

                List<CreditTransaction> debits = new ArrayList<>();
                for (CreditAllocation allocation : calculator.allocate(history, asOf)) {
                    if (!allocation.hasForfeitableRemainder()) {
                        continue;
                    }
                    if (!store.findBySource(allocation.getCreditId(), TransactionReason.EXPIRY).isEmpty()) {
                        log.warn("Credit {} of user {} already has an expiry debit, skipping",
                                allocation.getCreditId(), userId);
                        continue;
                    }
                    CreditTransaction debit = store.append(CreditTransaction.create(
                            userId, TransactionKind.DEBIT, TransactionReason.EXPIRY, allocation.getRemaining(),
                            EXPIRY_REFERENCE, "Credit expired " + allocation.getExpiresAt(), EXPIRY_ACTOR,
                            asOf, allocation.getCreditId()));
                    debits.add(debit);
                    history.add(debit);
                }
                return new ExpiryResult(userId, List.copyOf(debits), balanceOf(history, asOf));
            });

            for (CreditTransaction debit : result.getDebits()) {
                metrics.recordCreditExpired(debit.getAmount());
                emit(AuditAction.CREDIT_EXPIRED, debit, result.getBalanceAfter());
            }
            if (!result.isEmpty()) {
                log.info("Expired {} credit(s) totalling {} for user {}, balance now {}",
                        result.getDebits().size(), result.getTotalExpired(), userId, result.getBalanceAfter());
            }
            return result;
        });
    }

    /**
     * Validates an amount and brings it to the currency scale.
     *
     * @return empty for null, non-positive amounts, or amounts finer than
     *         the currency's minor unit
     */
    public Optional<BigDecimal> normalizeAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return Optional.empty();
        }
        if (amount.stripTrailingZeros().scale() > currencyScale) {
            return Optional.empty();
        }
        return Optional.of(amount.setScale(currencyScale));
    }

    // ==================== Helpers ====================

    /**
     * Runs one operation with correlation id, MDC, metrics and storage error
     * logging. {@code userId} may be null when the body resolves it itself.
     */
    private <T> T execute(String operation, UUID userId, Supplier<T> body) {
        boolean ownsCorrelation = !CorrelationContext.hasCorrelationId();
        if (ownsCorrelation) {
            CorrelationContext.setCorrelationId(null);
        }
        String previousUser = MDC.get(CorrelationContext.USER_ID_MDC_KEY);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        if (userId != null) {
            MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId.toString());
        }

        long start = System.nanoTime();
        String outcome = "OK";
        try {
            T result = body.get();
            if (result instanceof LedgerOutcome ledgerOutcome) {
                outcome = ledgerOutcome.getStatus().name();
            }
            return result;
        } catch (StorageException e) {
            outcome = "STORAGE_ERROR";
            log.error("Storage failure during {} for user {}: {}", operation,
                    MDC.get(CorrelationContext.USER_ID_MDC_KEY), e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordOperation(operation, outcome);
            metrics.recordLatency(operation, Duration.ofNanos(System.nanoTime() - start));
            if (previousUser != null) {
                MDC.put(CorrelationContext.USER_ID_MDC_KEY, previousUser);
            } else {
                MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            }
            if (ownsCorrelation) {
                MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
                CorrelationContext.clear();
            }
        }
    }

    private void emit(AuditAction action, CreditTransaction transaction, BigDecimal balanceAfter) {
        WalletAuditEvent event = WalletAuditEvent.of(action, transaction, balanceAfter,
                CorrelationContext.getCorrelationId());
        try {
            auditSink.record(event);
        } catch (Exception e) {
            metrics.recordAuditFailure();
            log.error("AUDIT LOSS: action={}, actor={}, user={}, amount={}, reference={}, transactionId={}, "
                            + "balanceAfter={}, occurredAt={}, correlationId={}",
                    action.getWireName(), event.getActor(), event.getTargetUser(), event.getAmount(),
                    event.getReference(), event.getTransactionId(), balanceAfter, event.getOccurredAt(),
                    event.getCorrelationId(), e);
        }
    }

    private Optional<CreditTransaction> findPrior(UUID userId, TransactionKind kind,
                                                  TransactionReason reason, String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        return store.findByReference(userId, kind, reason, reference);
    }

    private void warnOnMismatch(CreditTransaction prior, BigDecimal requested) {
        if (prior.getAmount().compareTo(requested) != 0) {
            log.warn("Reference {} reused with a different amount: first {}, now {}; keeping the first",
                    prior.getReference(), prior.getAmount(), requested);
        }
    }

    private BigDecimal balanceOf(List<CreditTransaction> history, Instant asOf) {
        return calculator.compute(history, asOf).getBalance();
    }

    private static List<CreditTransaction> with(List<CreditTransaction> history, CreditTransaction tx) {
        List<CreditTransaction> extended = new ArrayList<>(history.size() + 1);
        extended.addAll(history);
        extended.add(tx);
        return extended;
    }

    /**
     * Timestamp for a new entry: now, but never earlier than the user's latest
     * entry, so a node with a lagging clock cannot write behind the ledger.
     */
    private Instant effectiveNow(List<CreditTransaction> history) {
        Instant now = now();
        for (CreditTransaction tx : history) {
            if (tx.getCreatedAt().isAfter(now)) {
                now = tx.getCreatedAt();
            }
        }
        return now;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static String invalidAmountMessage(BigDecimal amount) {
        return amount == null
                ? "Amount is required"
                : "Amount must be positive with at most the currency's minor-unit precision, got "
                        + amount.toPlainString();
    }
}
