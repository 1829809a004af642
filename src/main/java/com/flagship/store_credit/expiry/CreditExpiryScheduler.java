package com.flagship.store_credit.expiry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the expiry sweep daily. Disable with
 * {@code wallet.expiry.scheduler.enabled=false} when an external scheduler
 * drives {@link CreditExpiryEngine#sweep()}.
 */
@Component
@ConditionalOnProperty(name = "wallet.expiry.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CreditExpiryScheduler {

    private final CreditExpiryEngine engine;

    @Scheduled(cron = "${wallet.expiry.sweep-cron:0 30 2 * * *}", zone = "UTC")
    public void runSweep() {
        try {
            engine.sweep();
        } catch (Exception e) {
            log.error("Scheduled expiry sweep aborted", e);
        }
    }
}
