package com.flagship.store_credit.observability;

import java.util.Optional;
import java.util.UUID;

/**
 * Thread-local correlation id for wallet operations.
 *
 * Set per ledger call and per expiry sweep, mirrored into the logging MDC,
 * and stamped on every audit event so a sweep's debits can be traced back
 * to the run that produced them.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String SWEEP_ID_MDC_KEY = "sweepId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static Optional<String> current() {
        return Optional.ofNullable(correlationId.get());
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
