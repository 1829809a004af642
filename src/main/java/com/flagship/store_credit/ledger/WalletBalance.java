package com.flagship.store_credit.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Spendable balance of a wallet, derived from its transactions as of a point
 * in time. Balances are computed, never stored.
 */
@Value
public class WalletBalance {
    BigDecimal balance;
    List<ExpiringCredit> expiringSoon;
    Instant asOf;

    public static WalletBalance empty(Instant asOf) {
        return new WalletBalance(BigDecimal.ZERO, List.of(), asOf);
    }
}
