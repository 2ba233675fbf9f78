package com.flagship.transfer_ledger.ledger;

import com.flagship.transfer_ledger.account.Account;
import com.flagship.transfer_ledger.account.AccountStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA Entity for Account persistence.
 *
 * Key design principles:
 * - No @Setter: balance and status change only through updateFromDomain()
 * - Descriptive fields and created_at are updatable = false
 * - The account id is allocated by the account_id_seq sequence, never by JPA
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_customer_id", columnList = "customer_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(name = "account_id", nullable = false, updatable = false)
    private Long accountId;

    @Column(name = "customer_id", updatable = false)
    private Long customerId;

    @Column(name = "account_number", nullable = false, unique = true, updatable = false)
    private String accountNumber;

    @Column(name = "account_type", updatable = false)
    private String accountType;

    @Column(nullable = false, precision = 20, scale = 2)
    private BigDecimal balance;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AccountStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "customer_name", updatable = false)
    private String customerName;

    public static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            account.getAccountId(),
            account.getCustomerId(),
            account.getAccountNumber(),
            account.getAccountType(),
            account.getBalance(),
            account.getCurrency(),
            account.getStatus(),
            account.getCreatedAt(),
            account.getCustomerName()
        );
    }

    public Account toDomain() {
        return new Account(
            accountId,
            customerId,
            accountNumber,
            accountType,
            currency,
            customerName,
            balance,
            status,
            createdAt
        );
    }

    /**
     * Updates entity from domain object.
     * Only mutable fields (balance, status) can be updated.
     */
    public void updateFromDomain(Account account) {
        if (!accountId.equals(account.getAccountId())) {
            throw new IllegalArgumentException(
                "Cannot update account " + accountId + " from account " + account.getAccountId());
        }
        this.balance = account.getBalance();
        this.status = account.getStatus();
    }
}
