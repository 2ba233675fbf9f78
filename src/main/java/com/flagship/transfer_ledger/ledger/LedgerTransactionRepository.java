package com.flagship.transfer_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Repository for the transaction log.
 */
@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransactionEntity, Long> {

    /**
     * Sums the amounts sent by an account with created_at in [windowStart, windowEnd].
     * Served by idx_transactions_from_account_created_at.
     */
    @Query("""
        SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransactionEntity t
        WHERE t.fromAccount = :accountId
          AND t.createdAt >= :windowStart
          AND t.createdAt <= :windowEnd
        """)
    BigDecimal sumSentBetween(@Param("accountId") Long accountId,
                              @Param("windowStart") Instant windowStart,
                              @Param("windowEnd") Instant windowEnd);

    /**
     * All transactions an account took part in, oldest first (for auditing).
     */
    @Query("""
        SELECT t FROM LedgerTransactionEntity t
        WHERE t.fromAccount = :accountId OR t.toAccount = :accountId
        ORDER BY t.id ASC
        """)
    List<LedgerTransactionEntity> findByAccount(@Param("accountId") Long accountId);
}
