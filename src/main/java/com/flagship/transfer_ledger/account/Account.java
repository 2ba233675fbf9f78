package com.flagship.transfer_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Account domain object.
 *
 * Key principles:
 * - Balance is exact decimal and never negative
 * - State changes are immutable (create new Account with new balance or status)
 * - Only balance and status ever change after creation
 */
@Value
public class Account {
    Long accountId;
    Long customerId;
    String accountNumber;
    String accountType;
    String currency;
    String customerName;
    BigDecimal balance;
    AccountStatus status;
    Instant createdAt;

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    /**
     * Removes funds from this account.
     *
     * @return New Account instance with the reduced balance
     * @throws IllegalStateException if the balance would drop below zero
     */
    public Account debit(BigDecimal amount) {
        requirePositive(amount);
        BigDecimal newBalance = balance.subtract(amount);
        if (newBalance.signum() < 0) {
            throw new IllegalStateException(
                String.format("Cannot debit %s from account %d with balance %s", amount, accountId, balance));
        }
        return withBalance(newBalance);
    }

    /**
     * Adds funds to this account.
     *
     * @return New Account instance with the increased balance
     */
    public Account credit(BigDecimal amount) {
        requirePositive(amount);
        return withBalance(balance.add(amount));
    }

    /**
     * Moves the account to another status.
     *
     * @return New Account instance with the target status
     * @throws IllegalStateException if the transition is not allowed
     */
    public Account changeStatus(AccountStatus targetStatus) {
        if (!status.canTransitionTo(targetStatus)) {
            throw new IllegalStateException(
                String.format("Cannot change account %d from %s to %s", accountId, status, targetStatus));
        }
        return new Account(accountId, customerId, accountNumber, accountType, currency,
            customerName, balance, targetStatus, createdAt);
    }

    private Account withBalance(BigDecimal newBalance) {
        return new Account(accountId, customerId, accountNumber, accountType, currency,
            customerName, newBalance, status, createdAt);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
