package com.flagship.store_credit.audit;

import com.flagship.store_credit.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes audit events to the transactional outbox, from where
 * {@link com.flagship.store_credit.outbox.OutboxPublisher} relays them to Kafka.
 *
 * The wallet user is the aggregate, so all events of one user land on the
 * same partition in order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxAuditSink implements AuditSink {

    static final String AGGREGATE_TYPE = "Wallet";

    private final OutboxService outboxService;

    @Override
    public void record(WalletAuditEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, event.getTargetUser(),
                event.getAction().getWireName(), event.getCorrelationId(), event);
        log.debug("Queued audit event {} ({}) for user {}",
                event.getEventId(), event.getAction().getWireName(), event.getTargetUser());
    }
}
