package com.simscan.ledger;

import com.simscan.error.NotFoundException;
import com.simscan.error.ValidationException;
import com.simscan.mapper.UserMapper;
import com.simscan.user.AccountService;
import com.simscan.user.domain.UserAccount;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class CreditLedgerIntegrationTest {

    @Autowired
    private CreditLedger ledger;
    @Autowired
    private CreditResetJob resetJob;
    @Autowired
    private AccountService accountService;
    @Autowired
    private UserMapper userMapper;

    private UserAccount newUser() {
        String name = "ledger-" + UUID.randomUUID().toString().substring(0, 8);
        return accountService.register(name, name + "@example.com", "password1");
    }

    @Test
    void newUsersStartWithTwentyCredits() {
        UserAccount user = newUser();
        assertEquals(20, ledger.balanceOf(user.getId()));
    }

    @Test
    void deductionStopsAtZero() {
        UserAccount user = newUser();
        assertTrue(ledger.tryDeduct(user.getId(), 19));
        assertTrue(ledger.tryDeduct(user.getId()));
        assertFalse(ledger.tryDeduct(user.getId()));
        assertEquals(0, ledger.balanceOf(user.getId()));
    }

    @Test
    void concurrentDeductionsNeverOverspend() throws Exception {
        UserAccount user = newUser();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return ledger.tryDeduct(user.getId());
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<Boolean> f : results) {
                if (f.get(30, TimeUnit.SECONDS)) succeeded++;
            }
            assertEquals(20, succeeded);
            assertEquals(0, ledger.balanceOf(user.getId()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void grantAddsToBalance() {
        UserAccount user = newUser();
        ledger.grant(user.getId(), 5);
        assertEquals(25, ledger.balanceOf(user.getId()));
    }

    @Test
    void invalidAmountsAndUnknownUsersAreRejected() {
        UserAccount user = newUser();
        assertThrows(ValidationException.class, () -> ledger.tryDeduct(user.getId(), 0));
        assertThrows(ValidationException.class, () -> ledger.grant(user.getId(), -1));
        assertThrows(NotFoundException.class, () -> ledger.tryDeduct(Long.MAX_VALUE, 1));
        assertThrows(NotFoundException.class, () -> ledger.balanceOf(Long.MAX_VALUE));
    }

    @Test
    void dailyResetRestoresUsersAndLeavesAdminAlone() {
        UserAccount drained = newUser();
        UserAccount topped = newUser();
        ledger.tryDeduct(drained.getId(), 20);
        ledger.grant(topped.getId(), 30);
        UserAccount admin = userMapper.selectByEmail("root-admin@example.com");
        int adminBefore = admin.getCredits();

        resetJob.resetCreditsDaily();

        assertEquals(20, ledger.balanceOf(drained.getId()));
        assertEquals(20, ledger.balanceOf(topped.getId()));
        assertEquals(adminBefore, ledger.balanceOf(admin.getId()));
    }
}
