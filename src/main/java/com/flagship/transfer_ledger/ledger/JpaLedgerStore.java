package com.flagship.transfer_ledger.ledger;

import com.flagship.transfer_ledger.account.Account;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ledger store backed by Spring Data JPA.
 *
 * Locked reads and writes use MANDATORY propagation: they must run inside the
 * caller's transaction, otherwise the row lock would be released as soon as
 * the read returns.
 *
 * Writes are flushed immediately so that constraint violations (negative
 * balance, unknown account) surface inside the caller's unit of work.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private final AccountRepository accountRepository;
    private final LedgerTransactionRepository transactionRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Account> getForUpdate(Long accountId) {
        Optional<Account> account = accountRepository.findByIdForUpdate(accountId)
            .map(AccountEntity::toDomain);
        log.debug("Locked account {}: found={}", accountId, account.isPresent());
        return account;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void save(Account account) {
        AccountEntity entity = accountRepository.findById(account.getAccountId())
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + account.getAccountId()));

        entity.updateFromDomain(account);
        accountRepository.saveAndFlush(entity);
        log.debug("Saved account {}: balance={}, status={}",
                account.getAccountId(), account.getBalance(), account.getStatus());
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerTransaction appendTransaction(LedgerTransaction transaction) {
        LedgerTransactionEntity saved = transactionRepository.saveAndFlush(
            LedgerTransactionEntity.fromDomain(transaction));
        log.debug("Appended transaction {}: from={}, to={}, amount={}",
                saved.getId(), saved.getFromAccount(), saved.getToAccount(), saved.getAmount());
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public BigDecimal sumSentSince(Long accountId, Instant windowStart, Instant windowEnd) {
        BigDecimal sum = transactionRepository.sumSentBetween(accountId, windowStart, windowEnd);
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerTransaction> transactionsFor(Long accountId) {
        return transactionRepository.findByAccount(accountId)
            .stream()
            .map(LedgerTransactionEntity::toDomain)
            .toList();
    }
}
