package com.flagship.transfer_ledger.ledger;

import com.flagship.transfer_ledger.account.Account;
import com.flagship.transfer_ledger.account.AccountService;
import com.flagship.transfer_ledger.account.AccountStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.flagship.transfer_ledger.support.LedgerTestData.balanceOf;
import static com.flagship.transfer_ledger.support.LedgerTestData.openAccount;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class JpaLedgerStoreTest {

    private static final Instant DAY_START = Instant.parse("2024-05-10T00:00:00Z");
    private static final Instant DAY_END = Instant.parse("2024-05-10T23:59:59.999999Z");

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;
    private Account sender;
    private Account receiver;

    @BeforeEach
    void setUp() {
        transactionTemplate = new TransactionTemplate(transactionManager);
        sender = openAccount(accountService, "1000.00");
        receiver = openAccount(accountService, "0.00");
    }

    private void insertTransaction(Long from, Long to, String amount, Instant createdAt) {
        jdbcTemplate.update(
            "INSERT INTO transactions (from_account, to_account, amount, created_at) VALUES (?, ?, ?, ?)",
            from, to, new BigDecimal(amount), createdAt.atOffset(ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Daily sum includes both window ends and nothing outside them")
    void testSumSentWindowBoundaries() {
        Long from = sender.getAccountId();
        Long to = receiver.getAccountId();
        insertTransaction(from, to, "1.00", DAY_START.minusSeconds(1));
        insertTransaction(from, to, "10.00", DAY_START);
        insertTransaction(from, to, "20.00", Instant.parse("2024-05-10T12:00:00Z"));
        insertTransaction(from, to, "30.00", Instant.parse("2024-05-10T23:59:59Z"));
        insertTransaction(from, to, "100.00", Instant.parse("2024-05-11T00:00:00Z"));
        insertTransaction(to, from, "500.00", Instant.parse("2024-05-10T12:00:00Z"));

        BigDecimal sent = ledgerStore.sumSentSince(from, DAY_START, DAY_END);

        assertEquals(0, new BigDecimal("60.00").compareTo(sent));
    }

    @Test
    @DisplayName("Daily sum is zero when nothing was sent")
    void testSumSentNothing() {
        BigDecimal sent = ledgerStore.sumSentSince(receiver.getAccountId(), DAY_START, DAY_END);

        assertEquals(0, BigDecimal.ZERO.compareTo(sent));
    }

    @Test
    @DisplayName("Locked reads and writes refuse to run outside a transaction")
    void testMandatoryTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> ledgerStore.getForUpdate(sender.getAccountId()));
        assertThrows(IllegalTransactionStateException.class,
            () -> ledgerStore.save(sender.debit(BigDecimal.ONE)));
        assertThrows(IllegalTransactionStateException.class,
            () -> ledgerStore.appendTransaction(LedgerTransaction.create(
                sender.getAccountId(), receiver.getAccountId(), BigDecimal.ONE, Instant.now())));
    }

    @Test
    @DisplayName("Locked read of an unknown account is empty")
    void testGetForUpdateMiss() {
        assertTrue(transactionTemplate.execute(status -> ledgerStore.getForUpdate(Long.MAX_VALUE)).isEmpty());
    }

    @Test
    @DisplayName("Save persists balance and status only")
    void testSavePersistsMutableFields() {
        transactionTemplate.executeWithoutResult(status -> {
            Account locked = ledgerStore.getForUpdate(sender.getAccountId()).orElseThrow();
            ledgerStore.save(locked.debit(new BigDecimal("0.01")).changeStatus(AccountStatus.FROZEN));
        });

        Account stored = accountService.getAccount(sender.getAccountId());
        assertEquals(new BigDecimal("999.99"), stored.getBalance());
        assertEquals(AccountStatus.FROZEN, stored.getStatus());
        assertEquals(sender.getAccountNumber(), stored.getAccountNumber());
        assertEquals(sender.getCreatedAt(), stored.getCreatedAt());
    }

    @Test
    @DisplayName("Rolled back writes leave no trace")
    void testRollbackDiscardsWrites() {
        transactionTemplate.executeWithoutResult(status -> {
            Account locked = ledgerStore.getForUpdate(sender.getAccountId()).orElseThrow();
            ledgerStore.save(locked.debit(new BigDecimal("500.00")));
            ledgerStore.appendTransaction(LedgerTransaction.create(
                sender.getAccountId(), receiver.getAccountId(), new BigDecimal("500.00"), Instant.now()));
            status.setRollbackOnly();
        });

        assertEquals(new BigDecimal("1000.00"), balanceOf(jdbcTemplate, sender.getAccountId()));
        assertTrue(ledgerStore.transactionsFor(sender.getAccountId()).isEmpty());
    }

    @Test
    @DisplayName("Appended transactions get increasing ids and are listed oldest first")
    void testAppendAssignsIncreasingIds() {
        List<LedgerTransaction> appended = transactionTemplate.execute(status -> List.of(
            ledgerStore.appendTransaction(LedgerTransaction.create(
                sender.getAccountId(), receiver.getAccountId(), new BigDecimal("1.00"), DAY_START)),
            ledgerStore.appendTransaction(LedgerTransaction.create(
                receiver.getAccountId(), sender.getAccountId(), new BigDecimal("2.00"), DAY_START))));

        assertNotNull(appended.get(0).getId());
        assertTrue(appended.get(1).getId() > appended.get(0).getId());

        List<LedgerTransaction> history = ledgerStore.transactionsFor(sender.getAccountId());
        assertEquals(List.of(appended.get(0).getId(), appended.get(1).getId()),
            history.stream().map(LedgerTransaction::getId).toList());
    }

    @Test
    @DisplayName("Database rejects a negative balance")
    void testNegativeBalanceRejectedByDatabase() {
        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "UPDATE accounts SET balance = -1 WHERE account_id = ?", sender.getAccountId()));
    }
}
