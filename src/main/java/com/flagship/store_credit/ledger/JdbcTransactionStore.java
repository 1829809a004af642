package com.flagship.store_credit.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * PostgreSQL transaction store.
 *
 * Uses JDBC directly: the ledger table is append-only and a database trigger
 * rejects UPDATE and DELETE, so there is nothing for an ORM to manage.
 *
 * Per-user serialisation uses a transaction-scoped advisory lock keyed by the
 * user id. The lock is released on commit or rollback, and both the lock wait
 * and the whole unit are bounded by timeouts. Statements outside a unit are
 * bounded by the same number of seconds as a query timeout.
 */
@Repository
@Slf4j
public class JdbcTransactionStore implements TransactionStore {

    private static final String COLUMNS =
        "id, user_id, kind, reason, amount, reference, notes, performed_by, created_at, " +
        "source_transaction_id, sequence_number";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final long lockTimeoutMs;

    public JdbcTransactionStore(DataSource dataSource,
                                PlatformTransactionManager transactionManager,
                                @Value("${wallet.store.transaction-timeout-seconds:5}") int transactionTimeoutSeconds,
                                @Value("${wallet.store.lock-timeout-ms:3000}") long lockTimeoutMs) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(transactionTimeoutSeconds);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(transactionTimeoutSeconds);
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public CreditTransaction append(CreditTransaction tx) {
        try {
            Long sequenceNumber = jdbcTemplate.queryForObject(
                "INSERT INTO credit_transactions (id, user_id, kind, reason, amount, reference, notes, " +
                "performed_by, created_at, source_transaction_id) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING sequence_number",
                Long.class,
                tx.getId(),
                tx.getUserId(),
                tx.getKind().name(),
                tx.getReason().name(),
                tx.getAmount(),
                tx.getReference(),
                tx.getNotes(),
                tx.getPerformedBy(),
                Timestamp.from(tx.getCreatedAt()),
                tx.getSourceTransactionId()
            );
            if (sequenceNumber == null) {
                throw new StorageException("No sequence number returned for transaction " + tx.getId());
            }
            return tx.withSequenceNumber(sequenceNumber);
        } catch (DataAccessException e) {
            throw new StorageException(
                String.format("Failed to append %s/%s transaction for user %s",
                    tx.getKind(), tx.getReason(), tx.getUserId()), e);
        }
    }

    @Override
    public List<CreditTransaction> listByUser(UUID userId, int limit) {
        return query(
            "SELECT " + COLUMNS + " FROM credit_transactions WHERE user_id = ? " +
            "ORDER BY created_at DESC, sequence_number DESC LIMIT ?",
            userId, limit);
    }

    @Override
    public List<CreditTransaction> listCreditsByUser(UUID userId) {
        return query(
            "SELECT " + COLUMNS + " FROM credit_transactions WHERE user_id = ? AND kind = 'CREDIT' " +
            "ORDER BY created_at, sequence_number",
            userId);
    }

    @Override
    public List<CreditTransaction> listAllByUser(UUID userId) {
        return query(
            "SELECT " + COLUMNS + " FROM credit_transactions WHERE user_id = ? " +
            "ORDER BY created_at, sequence_number",
            userId);
    }

    @Override
    public Optional<CreditTransaction> findById(UUID transactionId) {
        return query("SELECT " + COLUMNS + " FROM credit_transactions WHERE id = ?", transactionId)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<CreditTransaction> findByReference(UUID userId, TransactionKind kind,
                                                       TransactionReason reason, String reference) {
        return query(
            "SELECT " + COLUMNS + " FROM credit_transactions " +
            "WHERE user_id = ? AND kind = ? AND reason = ? AND reference = ? " +
            "ORDER BY sequence_number LIMIT 1",
            userId, kind.name(), reason.name(), reference)
            .stream()
            .findFirst();
    }

    @Override
    public List<CreditTransaction> findBySource(UUID sourceTransactionId, TransactionReason reason) {
        return query(
            "SELECT " + COLUMNS + " FROM credit_transactions " +
            "WHERE source_transaction_id = ? AND reason = ? ORDER BY sequence_number",
            sourceTransactionId, reason.name());
    }

    /**
     * Users holding a credit old enough to have expired that has no expiry
     * debit yet, skipping wallets whose debits already cover all their credits.
     * A spent credit never gets an expiry debit; the net check is what drops
     * its user once nothing is left to expire.
     */
    @Override
    public List<UUID> findExpiryCandidates(Instant cutoff) {
        try {
            return jdbcTemplate.queryForList(
                "SELECT DISTINCT c.user_id FROM credit_transactions c " +
                "WHERE c.kind = 'CREDIT' AND c.created_at <= ? " +
                "AND NOT EXISTS (SELECT 1 FROM credit_transactions d " +
                "                WHERE d.source_transaction_id = c.id AND d.reason = 'EXPIRY') " +
                "AND (SELECT SUM(CASE WHEN t.kind = 'CREDIT' THEN t.amount ELSE -t.amount END) " +
                "     FROM credit_transactions t WHERE t.user_id = c.user_id) > 0 " +
                "ORDER BY c.user_id",
                UUID.class,
                Timestamp.from(cutoff));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list expiry candidates", e);
        }
    }

    @Override
    public <T> T inUserTransaction(UUID userId, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                // SET does not take bind parameters; the value is a configured number
                jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
                jdbcTemplate.query(
                    "SELECT pg_advisory_xact_lock(hashtextextended(?, 0))",
                    (ResultSetExtractor<Void>) rs -> null,
                    userId.toString());
                log.debug("Acquired wallet lock for user {}", userId);
                return work.get();
            });
        } catch (TransactionException | DataAccessException e) {
            throw new StorageException("Wallet unit of work failed for user " + userId, e);
        }
    }

    private List<CreditTransaction> query(String sql, Object... args) {
        try {
            return jdbcTemplate.query(sql, transactionRowMapper(), args);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read wallet transactions", e);
        }
    }

    private RowMapper<CreditTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new CreditTransaction(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            TransactionKind.valueOf(rs.getString("kind")),
            TransactionReason.valueOf(rs.getString("reason")),
            rs.getBigDecimal("amount"),
            rs.getString("reference"),
            rs.getString("notes"),
            rs.getString("performed_by"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getObject("source_transaction_id", UUID.class),
            rs.getLong("sequence_number")
        );
    }
}
