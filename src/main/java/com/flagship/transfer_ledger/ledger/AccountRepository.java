package com.flagship.transfer_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Account persistence.
 */
@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

    /**
     * Finds an account and takes a row lock (SELECT ... FOR UPDATE) held until
     * the surrounding transaction ends. Concurrent callers block, there is no timeout.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.accountId = :accountId")
    Optional<AccountEntity> findByIdForUpdate(@Param("accountId") Long accountId);

    boolean existsByAccountNumber(String accountNumber);

    @Query("SELECT COALESCE(MAX(a.accountId), 0) FROM AccountEntity a")
    Long findMaxAccountId();
}
