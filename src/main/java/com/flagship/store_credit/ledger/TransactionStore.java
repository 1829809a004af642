package com.flagship.store_credit.ledger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Append-only persistence of wallet transactions.
 *
 * There are deliberately no update or delete operations. Every method
 * reports infrastructure failures as {@link StorageException}.
 */
public interface TransactionStore {

    /**
     * Persists a new entry atomically.
     *
     * @return the stored entry, carrying its sequence number
     */
    CreditTransaction append(CreditTransaction transaction);

    /**
     * Most recent entries of a user, newest first.
     */
    List<CreditTransaction> listByUser(UUID userId, int limit);

    /**
     * CREDIT entries of a user, oldest first.
     */
    List<CreditTransaction> listCreditsByUser(UUID userId);

    /**
     * Every entry of a user, oldest first.
     */
    List<CreditTransaction> listAllByUser(UUID userId);

    Optional<CreditTransaction> findById(UUID transactionId);

    /**
     * Looks up an earlier entry written with the same idempotency reference.
     */
    Optional<CreditTransaction> findByReference(UUID userId, TransactionKind kind,
                                                TransactionReason reason, String reference);

    /**
     * Entries of the given reason that point back at {@code sourceTransactionId}.
     */
    List<CreditTransaction> findBySource(UUID sourceTransactionId, TransactionReason reason);

    /**
     * Users holding at least one credit created at or before {@code cutoff}
     * that has no expiry debit yet, and whose credits exceed their debits.
     */
    List<UUID> findExpiryCandidates(Instant cutoff);

    /**
     * Runs {@code work} as a single atomic unit serialised against every other
     * unit of the same user. Units of different users never block each other.
     * If {@code work} throws, nothing it appended is kept.
     */
    <T> T inUserTransaction(UUID userId, Supplier<T> work);
}
