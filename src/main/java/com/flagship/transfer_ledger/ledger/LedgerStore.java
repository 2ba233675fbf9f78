package com.flagship.transfer_ledger.ledger;

import com.flagship.transfer_ledger.account.Account;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for accounts and the append-only transaction log.
 *
 * Locked reads and writes join the caller's transaction: every change made
 * inside one transaction becomes visible on commit or is discarded on rollback,
 * and row locks are released in both cases.
 */
public interface LedgerStore {

    /**
     * Returns the account and holds an exclusive row lock on it until the
     * enclosing transaction ends. Blocks while another transaction holds the lock.
     * A miss holds no lock.
     */
    Optional<Account> getForUpdate(Long accountId);

    /**
     * Persists the mutable fields (balance, status) of an account.
     */
    void save(Account account);

    /**
     * Writes a new immutable transaction entry.
     *
     * @return the stored transaction with its assigned id
     */
    LedgerTransaction appendTransaction(LedgerTransaction transaction);

    /**
     * Sum of amounts sent by an account with createdAt in [windowStart, windowEnd],
     * zero when there are none.
     */
    BigDecimal sumSentSince(Long accountId, Instant windowStart, Instant windowEnd);

    /**
     * Transactions the account sent or received, oldest first.
     */
    List<LedgerTransaction> transactionsFor(Long accountId);
}
