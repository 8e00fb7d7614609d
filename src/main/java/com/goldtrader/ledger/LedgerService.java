package com.goldtrader.ledger;

import com.goldtrader.entity.UserAccountEntity;
import com.goldtrader.exception.BusinessException;
import com.goldtrader.exception.ResourceNotFoundException;
import com.goldtrader.repository.jpa.UserAccountJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Single point of truth for user cash balances.
 *
 * <p>Every adjustment is a signed delta applied as one read-check-write. Adjustments to the same
 * account are serialized twice over: a per-user {@link ReentrantLock} held across the whole database
 * transaction (one process), and a PESSIMISTIC_WRITE row lock on the read (several processes
 * sharing the database). A balance is never driven below zero. A user's lock is dropped once no
 * thread holds or waits for it.
 *
 * <p>Accounts are opened lazily by the first positive adjustment.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final UserAccountJpaRepository userAccountJpaRepository;
    private final TransactionTemplate transactionTemplate;

    private final Map<String, AccountLock> accountLocks = new ConcurrentHashMap<>();

    public LedgerService(
            UserAccountJpaRepository userAccountJpaRepository, PlatformTransactionManager transactionManager) {
        this.userAccountJpaRepository = userAccountJpaRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Returns the user's balance.
     *
     * @throws ResourceNotFoundException if the user has no account yet
     */
    public BigDecimal getBalance(String userId) {
        return userAccountJpaRepository
                .findById(userId)
                .map(UserAccountEntity::getBalance)
                .orElseThrow(() -> new ResourceNotFoundException("Account", userId));
    }

    /** Returns the balance, or zero for a user who has never held funds. */
    public BigDecimal getBalanceOrZero(String userId) {
        return userAccountJpaRepository
                .findById(userId)
                .map(UserAccountEntity::getBalance)
                .orElse(BigDecimal.ZERO);
    }

    /**
     * Applies a signed delta to the user's balance.
     *
     * @return false, with nothing written, if the result would be negative
     */
    public boolean adjust(String userId, BigDecimal delta) {
        AccountLock accountLock = acquire(userId);
        try {
            Boolean applied = transactionTemplate.execute(status -> applyDelta(userId, delta));
            return Boolean.TRUE.equals(applied);
        } finally {
            release(userId, accountLock);
        }
    }

    /** Number of users whose lock is currently held or awaited. */
    public int lockedAccountCount() {
        return accountLocks.size();
    }

    /**
     * Adds funds to the user's account, opening it if needed.
     *
     * @return the new balance
     * @throws BusinessException if the amount is not positive
     */
    public BigDecimal deposit(String userId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException("amount", "Deposit amount must be positive");
        }
        adjust(userId, amount);
        log.info("Deposit: userId={}, amount={}", userId, amount);
        return getBalance(userId);
    }

    // holders is only touched inside compute, which runs atomically per key
    private AccountLock acquire(String userId) {
        AccountLock accountLock = accountLocks.compute(userId, (id, existing) -> {
            AccountLock entry = existing != null ? existing : new AccountLock();
            entry.holders++;
            return entry;
        });
        accountLock.lock.lock();
        return accountLock;
    }

    private void release(String userId, AccountLock accountLock) {
        accountLock.lock.unlock();
        accountLocks.computeIfPresent(userId, (id, entry) -> --entry.holders == 0 ? null : entry);
    }

    private boolean applyDelta(String userId, BigDecimal delta) {
        Optional<UserAccountEntity> existing = userAccountJpaRepository.findForUpdate(userId);
        BigDecimal current = existing.map(UserAccountEntity::getBalance).orElse(BigDecimal.ZERO);
        BigDecimal updated = current.add(delta);

        if (updated.signum() < 0) {
            log.warn("Balance adjustment rejected: userId={}, balance={}, delta={}", userId, current, delta);
            return false;
        }

        LocalDateTime now = LocalDateTime.now();
        UserAccountEntity account = existing.orElseGet(() -> UserAccountEntity.builder()
                .userId(userId)
                .createdAt(now)
                .build());
        account.setBalance(updated);
        account.setUpdatedAt(now);
        userAccountJpaRepository.save(account);

        log.debug("Balance adjusted: userId={}, delta={}, balance={}", userId, delta, updated);
        return true;
    }

    private static final class AccountLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
