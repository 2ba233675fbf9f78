package com.flagship.transfer_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Domain model for a ledger transaction: one completed money movement.
 *
 * Key invariant: entries are append-only. Once written they are never
 * updated or deleted, they are the source of truth for daily limits and audit.
 * The id is null until the store assigns one.
 */
@Value
public class LedgerTransaction {
    Long id;
    Long fromAccount;
    Long toAccount;
    BigDecimal amount;
    Instant createdAt;

    /**
     * Creates a new, not yet stored, transaction.
     */
    public static LedgerTransaction create(Long fromAccount, Long toAccount, BigDecimal amount, Instant createdAt) {
        Objects.requireNonNull(fromAccount, "fromAccount");
        Objects.requireNonNull(toAccount, "toAccount");
        Objects.requireNonNull(createdAt, "createdAt");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        return new LedgerTransaction(null, fromAccount, toAccount, amount, createdAt);
    }
}
