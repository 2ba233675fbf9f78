package com.flagship.transfer_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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
 * JPA entity for the append-only transaction log.
 *
 * Every column is updatable = false and there are no mutators.
 * On PostgreSQL a trigger additionally rejects UPDATE and DELETE.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_from_account_created_at", columnList = "from_account, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "from_account", nullable = false, updatable = false)
    private Long fromAccount;

    @Column(name = "to_account", nullable = false, updatable = false)
    private Long toAccount;

    @Column(nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LedgerTransactionEntity fromDomain(LedgerTransaction transaction) {
        if (transaction.getId() != null) {
            throw new IllegalStateException(
                "Transaction " + transaction.getId() + " is already recorded and cannot be written again");
        }
        return new LedgerTransactionEntity(
            null, // id - assigned by the identity column
            transaction.getFromAccount(),
            transaction.getToAccount(),
            transaction.getAmount(),
            transaction.getCreatedAt()
        );
    }

    public LedgerTransaction toDomain() {
        return new LedgerTransaction(id, fromAccount, toAccount, amount, createdAt);
    }
}
