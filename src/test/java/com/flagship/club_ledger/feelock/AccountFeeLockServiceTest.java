package com.flagship.club_ledger.feelock;

import com.flagship.club_ledger.LedgerIntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AccountFeeLockServiceTest extends LedgerIntegrationTestSupport {

    private static final String PERIOD = "2025-06";

    @Autowired
    private AccountFeeLockService feeLockService;

    @Test
    @DisplayName("Ten concurrent checkouts in one period charge the account fee once")
    void testConcurrentClaims() throws InterruptedException {
        printTestHeader("Concurrent Account Fee Claims");

        String account = uniqueId("acct");
        printInput("Account", account);
        printInput("Period", PERIOD);

        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        List<FeeLockClaim> claims = new CopyOnWriteArrayList<>();
        AtomicInteger errors = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    claims.add(feeLockService.tryClaim(account, PERIOD));
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        long charged = claims.stream().filter(FeeLockClaim::shouldCharge).count();
        printOutput("Charged", charged);
        assertEquals(0, errors.get());
        assertEquals(threads, claims.size());
        assertEquals(1, charged);

        String winner = claims.stream().filter(FeeLockClaim::shouldCharge).findFirst().orElseThrow().lockId();
        assertEquals(winner, feeLockService.find(account, PERIOD).orElseThrow().lockId());
        printSuccess("Exactly one checkout carries the fee");
    }

    @Test
    @DisplayName("An expired unconfirmed lock is taken over with a new lock id")
    void testRolloverAfterExpiry() {
        printTestHeader("Expired Lock Rollover");

        String account = uniqueId("acct");
        FeeLockClaim first = feeLockService.tryClaim(account, PERIOD);
        assertTrue(first.shouldCharge());
        assertFalse(feeLockService.tryClaim(account, PERIOD).shouldCharge());

        // Abandoned checkout: lock expired without a paid initiation
        jdbcTemplate.update("UPDATE account_fee_locks SET expires_at = now() - interval '1 hour' "
                + "WHERE account_ref = ? AND period_key = ?", account, PERIOD);

        FeeLockClaim second = feeLockService.tryClaim(account, PERIOD);
        printOutput("Second claim", second);
        assertTrue(second.shouldCharge());
        assertTrue(second.rollover());
        assertNotEquals(first.lockId(), second.lockId());

        // The abandoned lock can no longer be confirmed
        assertFalse(feeLockService.confirm(first.lockId()));
        assertTrue(feeLockService.confirm(second.lockId()));
        printSuccess("Abandoned lock replaced");
    }

    @Test
    @DisplayName("A confirmed lock never rolls over")
    void testConfirmedLockIsFinal() {
        printTestHeader("Confirmed Lock Final");

        String account = uniqueId("acct");
        FeeLockClaim claim = feeLockService.tryClaim(account, PERIOD);
        assertTrue(feeLockService.confirm(claim.lockId()));

        jdbcTemplate.update("UPDATE account_fee_locks SET expires_at = now() - interval '1 hour' "
                + "WHERE account_ref = ? AND period_key = ?", account, PERIOD);

        FeeLockClaim later = feeLockService.tryClaim(account, PERIOD);
        assertFalse(later.shouldCharge());
        assertEquals(claim.lockId(), later.lockId());

        AccountFeeLock lock = feeLockService.find(account, PERIOD).orElseThrow();
        printOutput("Status", lock.status());
        assertEquals(AccountFeeLockStatus.CONFIRMED, lock.status());
        assertNotNull(lock.confirmedAt());
        printSuccess("Paid period stays paid");
    }

    @Test
    @DisplayName("Confirming twice only succeeds once")
    void testConfirmIdempotent() {
        printTestHeader("Confirm Idempotent");

        String account = uniqueId("acct");
        FeeLockClaim claim = feeLockService.tryClaim(account, PERIOD);

        assertTrue(feeLockService.confirm(claim.lockId()));
        assertFalse(feeLockService.confirm(claim.lockId()));
        assertFalse(feeLockService.confirm("not-a-uuid"));
        printSuccess("Second confirmation is a no-op");
    }

    @Test
    @DisplayName("Periods are independent")
    void testSeparatePeriods() {
        printTestHeader("Separate Periods");

        String account = uniqueId("acct");
        assertTrue(feeLockService.tryClaim(account, "2025-06").shouldCharge());
        assertTrue(feeLockService.tryClaim(account, "2025-07").shouldCharge());
        assertTrue(feeLockService.currentPeriodKey().matches("\\d{4}-\\d{2}"));
        assertThrows(IllegalArgumentException.class, () -> feeLockService.tryClaim(" ", PERIOD));
        printSuccess("One fee per period");
    }
}
