package com.flagship.store_credit.expiry;

import com.flagship.store_credit.ledger.BalanceCalculator;
import com.flagship.store_credit.ledger.ExpiryResult;
import com.flagship.store_credit.ledger.LedgerService;
import com.flagship.store_credit.ledger.TransactionStore;
import com.flagship.store_credit.observability.CorrelationContext;
import com.flagship.store_credit.observability.WalletMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Materialises credit expiry as explicit debits.
 *
 * A sweep asks the store for users that may hold an expired, not yet swept
 * credit and processes them one at a time through
 * {@link LedgerService#expireCredits}, so a user's lock is held only while
 * that user is processed. A failure for one user is recorded in the report
 * and the sweep moves on. Running a sweep twice over the same state writes
 * nothing the second time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditExpiryEngine {

    private final TransactionStore store;
    private final LedgerService ledgerService;
    private final BalanceCalculator calculator;
    private final WalletMetrics metrics;
    private final Clock clock;

    public SweepReport sweep() {
        String sweepId = CorrelationContext.generateCorrelationId();
        CorrelationContext.setCorrelationId(sweepId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, sweepId);
        MDC.put(CorrelationContext.SWEEP_ID_MDC_KEY, sweepId);

        long start = System.nanoTime();
        try {
            Instant cutoff = calculator.expiryPolicy().candidateCutoff(clock.instant());
            List<UUID> candidates = store.findExpiryCandidates(cutoff);
            log.info("Expiry sweep {} started: {} candidate user(s), cutoff {}", sweepId, candidates.size(), cutoff);

            int usersWithExpiry = 0;
            int debitsCreated = 0;
            BigDecimal totalExpired = BigDecimal.ZERO;
            List<SweepReport.SweepFailure> failures = new ArrayList<>();

            for (UUID userId : candidates) {
                try {
                    ExpiryResult result = ledgerService.expireCredits(userId);
                    if (!result.isEmpty()) {
                        usersWithExpiry++;
                        debitsCreated += result.getDebits().size();
                        totalExpired = totalExpired.add(result.getTotalExpired());
                    }
                } catch (RuntimeException e) {
                    log.error("Expiry sweep {} failed for user {}: {}", sweepId, userId, e.getMessage(), e);
                    failures.add(new SweepReport.SweepFailure(userId, e.getClass().getSimpleName(), e.getMessage()));
                }
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordSweep(duration, failures.size());

            SweepReport report = new SweepReport(sweepId, candidates.size(), usersWithExpiry, debitsCreated,
                    totalExpired, List.copyOf(failures), duration);
            if (report.isClean()) {
                log.info("Expiry sweep {} finished in {} ms: {} user(s) scanned, {} debit(s) totalling {}",
                        sweepId, duration.toMillis(), report.getUsersScanned(), debitsCreated, totalExpired);
            } else {
                log.warn("Expiry sweep {} finished in {} ms with {} failed user(s): {} scanned, {} debit(s) totalling {}",
                        sweepId, duration.toMillis(), failures.size(), report.getUsersScanned(), debitsCreated,
                        totalExpired);
            }
            return report;
        } finally {
            MDC.remove(CorrelationContext.SWEEP_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    /**
     * Runs the expiry pass for a single user, e.g. from an operator tool.
     * Unlike {@link #sweep()} this propagates storage failures.
     */
    public ExpiryResult sweepUser(UUID userId) {
        return ledgerService.expireCredits(userId);
    }
}
