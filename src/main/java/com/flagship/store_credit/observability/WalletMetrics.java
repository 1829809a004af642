package com.flagship.store_credit.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Micrometer metrics for wallet operations.
 *
 * Metrics exposed:
 * - wallet.operations: counter tagged by operation and outcome
 * - wallet.operation.latency: timer tagged by operation
 * - wallet.credit.expired.amount: summary of amounts forfeited by the sweep
 * - wallet.credit.expired.count: number of expiry debits written
 * - wallet.expiry.sweep.duration: timer for full sweeps
 * - wallet.expiry.sweep.failures: users the sweep could not process
 * - wallet.audit.failures: audit events that could not be recorded
 */
@Component
public class WalletMetrics {

    private final MeterRegistry registry;

    private final DistributionSummary expiredAmount;
    private final Counter expiredCredits;
    private final Counter sweepFailures;
    private final Counter auditFailures;
    private final Timer sweepTimer;

    public WalletMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.expiredAmount = DistributionSummary.builder("wallet.credit.expired.amount")
                .description("Credit amount forfeited by expiry")
                .register(registry);

        this.expiredCredits = Counter.builder("wallet.credit.expired.count")
                .description("Number of expiry debits written")
                .register(registry);

        this.sweepFailures = Counter.builder("wallet.expiry.sweep.failures")
                .description("Users the expiry sweep failed to process")
                .register(registry);

        this.auditFailures = Counter.builder("wallet.audit.failures")
                .description("Audit events that could not be recorded")
                .register(registry);

        this.sweepTimer = Timer.builder("wallet.expiry.sweep.duration")
                .description("Time taken by a full expiry sweep")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Records the outcome of a ledger operation, e.g. (redeem, INSUFFICIENT_BALANCE).
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("wallet.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("wallet.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    public void recordCreditExpired(BigDecimal amount) {
        expiredCredits.increment();
        expiredAmount.record(amount.doubleValue());
    }

    public void recordSweep(Duration duration, int failedUsers) {
        sweepTimer.record(duration);
        if (failedUsers > 0) {
            sweepFailures.increment(failedUsers);
        }
    }

    public void recordAuditFailure() {
        auditFailures.increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
