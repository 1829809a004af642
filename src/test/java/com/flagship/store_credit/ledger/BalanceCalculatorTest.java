package com.flagship.store_credit.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BalanceCalculatorTest {

    private static final UUID USER = UUID.randomUUID();
    private static final Instant T = Instant.parse("2024-01-10T12:00:00Z");

    private final BalanceCalculator calculator = new BalanceCalculator(new ExpiryPolicy(12, Duration.ofDays(30)));
    private long sequence;

    @Test
    void emptyLedgerHasZeroBalance() {
        WalletBalance balance = calculator.compute(List.of(), T);

        assertAmount("0", balance.getBalance());
        assertTrue(balance.getExpiringSoon().isEmpty());
        assertEquals(T, balance.getAsOf());
    }

    @Test
    @DisplayName("Issue 200 then redeem 150 leaves 50")
    void issueThenRedeem() {
        List<CreditTransaction> txs = List.of(
                credit("200.00", T),
                debit("150.00", T.plus(Duration.ofDays(1))));

        assertAmount("50", calculator.compute(txs, T.plus(Duration.ofDays(2))).getBalance());
    }

    @Test
    @DisplayName("Entries created after the evaluation time are ignored")
    void ignoresFutureEntries() {
        List<CreditTransaction> txs = List.of(credit("100.00", T.plusSeconds(60)));

        assertAmount("0", calculator.compute(txs, T).getBalance());
        assertAmount("100", calculator.compute(txs, T.plusSeconds(60)).getBalance());
    }

    @Test
    @DisplayName("Input order does not matter, only (createdAt, sequence) does")
    void independentOfInputOrder() {
        List<CreditTransaction> txs = new ArrayList<>(List.of(
                credit("100.00", month(0)),
                credit("80.00", month(2)),
                debit("120.00", month(3)),
                credit("25.00", month(4)),
                debit("10.00", month(5))));
        BigDecimal expected = calculator.compute(txs, month(6)).getBalance();

        Collections.shuffle(txs, new Random(42));

        assertAmount("75", expected);
        assertAmount("75", calculator.compute(txs, month(6)).getBalance());
    }

    @Test
    @DisplayName("Entries written at the same instant are ordered by sequence number")
    void sameInstantUsesSequence() {
        CreditTransaction credit = credit("40.00", T);
        CreditTransaction debit = debit("40.00", T);

        List<CreditTransaction> reversed = List.of(debit, credit);

        assertAmount("0", calculator.compute(reversed, T).getBalance());
        assertAmount("0", calculator.unattributedDebits(reversed, T));
    }

    @Test
    @DisplayName("An overdrawn ledger reports the unattributed debit and floors the balance at zero")
    void overdrawnLedgerFloorsAtZero() {
        List<CreditTransaction> txs = List.of(
                credit("50.00", T),
                debit("80.00", T.plusSeconds(1)));

        assertAmount("0", calculator.compute(txs, T.plusSeconds(2)).getBalance());
        assertAmount("30", calculator.unattributedDebits(txs, T.plusSeconds(2)));
    }

    @Nested
    @DisplayName("FIFO attribution")
    class FifoAttribution {

        @Test
        @DisplayName("Redeem in month 2 consumes the month-0 credit, not the month-1 credit")
        void oldestCreditConsumedFirst() {
            CreditTransaction c1 = credit("100.00", month(0));
            CreditTransaction c2 = credit("100.00", month(1));
            List<CreditTransaction> txs = List.of(c1, c2, debit("100.00", month(2)));

            List<CreditAllocation> allocations = calculator.allocate(txs, month(2));

            assertEquals(c1.getId(), allocations.get(0).getCreditId());
            assertAmount("0", allocations.get(0).getRemaining());
            assertEquals(CreditState.FULLY_REDEEMED, allocations.get(0).getState());
            assertAmount("100", allocations.get(1).getRemaining());
            assertEquals(CreditState.ACTIVE, allocations.get(1).getState());
        }

        @Test
        @DisplayName("Month-1 credit stays spendable until month 13 and expires then")
        void secondCreditExpiresAtMonthThirteen() {
            CreditTransaction c2 = credit("100.00", month(1));
            List<CreditTransaction> txs = List.of(credit("100.00", month(0)), c2, debit("100.00", month(2)));

            assertAmount("100", calculator.compute(txs, month(12).plus(Duration.ofDays(1))).getBalance());
            assertAmount("100", calculator.compute(txs, month(13).minusSeconds(1)).getBalance());
            assertAmount("0", calculator.compute(txs, month(13)).getBalance());

            CreditAllocation second = calculator.allocate(txs, month(13)).get(1);
            assertEquals(c2.getId(), second.getCreditId());
            assertTrue(second.isExpired());
            assertTrue(second.hasForfeitableRemainder());
            assertEquals(CreditState.EXPIRED, second.getState());
        }

        @Test
        @DisplayName("A debit written after a credit expired cannot consume that credit")
        void debitSkipsExpiredCredit() {
            CreditTransaction c1 = credit("100.00", month(0));
            CreditTransaction c2 = credit("50.00", month(6));
            Instant afterExpiry = month(12).plus(Duration.ofDays(1));
            List<CreditTransaction> txs = List.of(c1, c2, debit("30.00", afterExpiry));

            List<CreditAllocation> allocations = calculator.allocate(txs, afterExpiry.plusSeconds(1));

            assertAmount("100", allocations.get(0).getRemaining());
            assertTrue(allocations.get(0).isExpired());
            assertAmount("20", allocations.get(1).getRemaining());
            assertAmount("20", calculator.compute(txs, afterExpiry.plusSeconds(1)).getBalance());
        }

        @Test
        void partialRedemptionState() {
            List<CreditTransaction> txs = List.of(credit("100.00", T), debit("40.00", T.plusSeconds(5)));

            CreditAllocation allocation = calculator.allocate(txs, T.plusSeconds(5)).get(0);

            assertEquals(CreditState.PARTIALLY_REDEEMED, allocation.getState());
            assertAmount("60", allocation.getRemaining());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("Expired remainder is excluded from the balance")
        void expiredRemainderExcluded() {
            List<CreditTransaction> txs = List.of(credit("300.00", T));

            assertAmount("300", calculator.compute(txs, month(12).minusSeconds(1)).getBalance());
            assertAmount("0", calculator.compute(txs, month(12)).getBalance());
        }

        @Test
        @DisplayName("An expiry debit neutralises exactly its source credit")
        void expiryDebitTargetsSource() {
            CreditTransaction c1 = credit("300.00", month(0));
            CreditTransaction later = credit("50.00", month(6));
            Instant sweepTime = month(12).plus(Duration.ofDays(1));
            List<CreditTransaction> txs = List.of(
                    c1,
                    debit("100.00", month(1)),
                    later,
                    expiryDebit("200.00", sweepTime, c1.getId()));

            WalletBalance balance = calculator.compute(txs, sweepTime.plusSeconds(1));
            CreditAllocation first = calculator.allocate(txs, sweepTime.plusSeconds(1)).get(0);

            assertAmount("50", balance.getBalance());
            assertAmount("0", first.getRemaining());
            assertAmount("200", first.getForfeited());
            assertFalse(first.hasForfeitableRemainder());
            assertEquals(CreditState.EXPIRED, first.getState());
            assertAmount("0", calculator.unattributedDebits(txs, sweepTime.plusSeconds(1)));
        }

        @Test
        @DisplayName("Expiring soon lists the remaining amount of credits inside the window")
        void expiringSoonShowsRemainder() {
            CreditTransaction c1 = credit("100.00", month(0));
            List<CreditTransaction> txs = List.of(
                    c1,
                    debit("30.00", month(1)),
                    credit("40.00", month(3)));

            WalletBalance balance = calculator.compute(txs, month(12).minus(Duration.ofDays(10)));

            assertAmount("110", balance.getBalance());
            assertEquals(1, balance.getExpiringSoon().size());
            ExpiringCredit expiring = balance.getExpiringSoon().get(0);
            assertEquals(c1.getId(), expiring.getCreditId());
            assertAmount("70", expiring.getAmount());
            assertEquals(month(12), expiring.getExpiresAt());

            assertTrue(calculator.compute(txs, month(10)).getExpiringSoon().isEmpty());
        }
    }

    // ==================== Helpers ====================

    private static Instant month(int n) {
        return T.atZone(ZoneOffset.UTC).plusMonths(n).toInstant();
    }

    private CreditTransaction credit(String amount, Instant at) {
        return new CreditTransaction(UUID.randomUUID(), USER, TransactionKind.CREDIT, TransactionReason.ISSUE,
                new BigDecimal(amount), null, null, "admin@test", at, null, ++sequence);
    }

    private CreditTransaction debit(String amount, Instant at) {
        return new CreditTransaction(UUID.randomUUID(), USER, TransactionKind.DEBIT, TransactionReason.REDEMPTION,
                new BigDecimal(amount), null, null, "checkout", at, null, ++sequence);
    }

    private CreditTransaction expiryDebit(String amount, Instant at, UUID source) {
        return new CreditTransaction(UUID.randomUUID(), USER, TransactionKind.DEBIT, TransactionReason.EXPIRY,
                new BigDecimal(amount), "expired", null, "system", at, source, ++sequence);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                () -> "expected " + expected + " but was " + actual);
    }
}
