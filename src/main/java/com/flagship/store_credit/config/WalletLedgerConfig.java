package com.flagship.store_credit.config;

import com.flagship.store_credit.ledger.ExpiryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wallet-wide rules and the clock every timestamp is taken from.
 */
@Configuration
@Slf4j
public class WalletLedgerConfig {

    @Bean
    public Clock walletClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExpiryPolicy expiryPolicy(@Value("${wallet.expiry.months:12}") int expiryMonths,
                                     @Value("${wallet.expiry.expiring-soon-days:30}") long expiringSoonDays) {
        log.info("Store credit expires after {} months, expiring-soon window {} days",
                expiryMonths, expiringSoonDays);
        return new ExpiryPolicy(expiryMonths, Duration.ofDays(expiringSoonDays));
    }
}
