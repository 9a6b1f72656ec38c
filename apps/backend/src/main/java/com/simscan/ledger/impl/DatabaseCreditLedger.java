package com.simscan.ledger.impl;

import com.simscan.config.CreditProperties;
import com.simscan.error.NotFoundException;
import com.simscan.error.ValidationException;
import com.simscan.ledger.CreditLedger;
import com.simscan.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

/**
 * Ledger backed by the {@code users.credits} column. The database row is the single source of truth,
 * so the conditional update holds across processes as well as threads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseCreditLedger implements CreditLedger {

    private final UserMapper userMapper;
    private final CreditProperties props;

    @Override
    public boolean tryDeduct(long userId, int amount) {
        requirePositive(amount);
        int attempts = Math.max(1, props.getDeductRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                int rows = userMapper.deductIfSufficient(userId, amount);
                if (rows == 1) {
                    log.debug("[LEDGER] deducted user={} amount={}", userId, amount);
                    return true;
                }
                requireUser(userId);
                log.info("[LEDGER] insufficient credit user={} amount={}", userId, amount);
                return false;
            } catch (DataIntegrityViolationException e) {
                // credits >= 0 check constraint: the balance was drained underneath us
                log.info("[LEDGER] deduction refused by constraint user={} amount={}", userId, amount);
                return false;
            } catch (TransientDataAccessException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.warn("[LEDGER] transient failure user={} attempt={}/{}: {}",
                        userId, attempt, attempts, e.getMessage());
            }
        }
    }

    @Override
    public void grant(long userId, int amount) {
        requirePositive(amount);
        int rows = userMapper.addCredits(userId, amount);
        if (rows == 0) {
            throw new NotFoundException("User not found: " + userId);
        }
        log.info("[LEDGER] granted user={} amount={}", userId, amount);
    }

    @Override
    public int resetAll(int defaultValue, String role) {
        if (defaultValue < 0) {
            throw new ValidationException("Reset value must not be negative");
        }
        int rows = userMapper.resetCreditsByRole(defaultValue, role);
        log.info("[LEDGER] reset role={} value={} rows={}", role, defaultValue, rows);
        return rows;
    }

    @Override
    public int balanceOf(long userId) {
        Integer credits = userMapper.selectCredits(userId);
        if (credits == null) {
            throw new NotFoundException("User not found: " + userId);
        }
        return credits;
    }

    private void requireUser(long userId) {
        if (userMapper.selectCredits(userId) == null) {
            throw new NotFoundException("User not found: " + userId);
        }
    }

    private static void requirePositive(int amount) {
        if (amount < 1) {
            throw new ValidationException("Credit amount must be at least 1");
        }
    }
}
