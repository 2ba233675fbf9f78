package com.flagship.transfer_ledger.account;

import com.flagship.transfer_ledger.ledger.AccountEntity;
import com.flagship.transfer_ledger.ledger.AccountRepository;
import com.flagship.transfer_ledger.ledger.LedgerStore;
import com.flagship.transfer_ledger.ledger.LedgerTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Service for the account lifecycle: opening accounts, reading them and
 * changing their status. Balances are never changed here, only by transfers.
 */
@Service
@Slf4j
public class AccountService {

    static final String DEFAULT_ACCOUNT_TYPE = "SAVINGS";
    static final String DEFAULT_CURRENCY = "INR";

    private final JdbcTemplate jdbcTemplate;
    private final AccountRepository accountRepository;
    private final LedgerStore ledgerStore;
    private final Clock clock;

    public AccountService(JdbcTemplate jdbcTemplate, AccountRepository accountRepository,
                          LedgerStore ledgerStore, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountRepository = accountRepository;
        this.ledgerStore = ledgerStore;
        this.clock = clock;
    }

    /**
     * Opens a new ACTIVE account.
     * The account id comes from the account_id_seq database sequence, so
     * concurrent callers never receive the same id.
     *
     * @throws IllegalArgumentException if required fields are missing or the balance is invalid
     */
    @Transactional
    public Account createAccount(NewAccountRequest request) {
        if (request.getCustomerId() == null) {
            throw new IllegalArgumentException("Customer ID is required");
        }
        if (request.getAccountNumber() == null || request.getAccountNumber().isBlank()) {
            throw new IllegalArgumentException("Account number is required");
        }
        if (accountRepository.existsByAccountNumber(request.getAccountNumber())) {
            throw new IllegalArgumentException("Account number already in use: " + request.getAccountNumber());
        }
        BigDecimal initialBalance = validateInitialBalance(request.getInitialBalance());

        Long accountId = jdbcTemplate.queryForObject("SELECT nextval('account_id_seq')", Long.class);
        Account account = new Account(
            accountId,
            request.getCustomerId(),
            request.getAccountNumber(),
            request.getAccountType() != null ? request.getAccountType() : DEFAULT_ACCOUNT_TYPE,
            request.getCurrency() != null ? request.getCurrency() : DEFAULT_CURRENCY,
            request.getCustomerName() != null ? request.getCustomerName() : defaultCustomerName(request.getCustomerId()),
            initialBalance,
            AccountStatus.ACTIVE,
            clock.instant().truncatedTo(ChronoUnit.MICROS)
        );
        insert(account);

        log.info("Opened account: accountId={}, customerId={}, balance={}",
                accountId, account.getCustomerId(), account.getBalance());
        return account;
    }

    /**
     * Writes an account row with the given id.
     * Used for new accounts and for seeding accounts with known ids.
     */
    void insert(Account account) {
        jdbcTemplate.update(
            "INSERT INTO accounts (account_id, customer_id, account_number, account_type, balance, " +
            "currency, status, created_at, customer_name) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            account.getAccountId(),
            account.getCustomerId(),
            account.getAccountNumber(),
            account.getAccountType(),
            account.getBalance(),
            account.getCurrency(),
            account.getStatus().name(),
            account.getCreatedAt().atOffset(ZoneOffset.UTC),
            account.getCustomerName()
        );
    }

    /**
     * Loads accounts with known ids into an empty ledger, then moves
     * account_id_seq past the highest seeded id.
     *
     * @return number of accounts written, 0 if the ledger already had accounts
     */
    @Transactional
    public int seedAccounts(List<Account> accounts) {
        if (hasAccounts()) {
            log.info("Ledger already has accounts, skipping seed");
            return 0;
        }
        accounts.forEach(this::insert);

        long nextId = accountRepository.findMaxAccountId() + 1;
        jdbcTemplate.execute("ALTER SEQUENCE account_id_seq RESTART WITH " + nextId);

        log.info("Seeded {} accounts, next account id is {}", accounts.size(), nextId);
        return accounts.size();
    }

    @Transactional(readOnly = true)
    public Optional<Account> findAccount(Long accountId) {
        return accountRepository.findById(accountId)
            .map(AccountEntity::toDomain);
    }

    /**
     * @throws IllegalArgumentException if the account does not exist
     */
    @Transactional(readOnly = true)
    public Account getAccount(Long accountId) {
        return findAccount(accountId)
            .orElseThrow(() -> new IllegalArgumentException("account not found: " + accountId));
    }

    /**
     * Changes the status of an account.
     * Takes the same row lock as transfers, so a status change never
     * overwrites a balance written by a concurrent transfer.
     *
     * @throws IllegalArgumentException if the account does not exist
     * @throws IllegalStateException if the transition is not allowed
     */
    @Transactional
    public Account changeStatus(Long accountId, AccountStatus targetStatus) {
        Account account = ledgerStore.getForUpdate(accountId)
            .orElseThrow(() -> new IllegalArgumentException("account not found: " + accountId));

        if (account.getStatus() == targetStatus) {
            return account;
        }

        Account changed = account.changeStatus(targetStatus);
        ledgerStore.save(changed);

        log.info("Changed account status: accountId={}, from={}, to={}",
                accountId, account.getStatus(), targetStatus);
        return changed;
    }

    /**
     * Changes the status of an account from its textual name (case-insensitive).
     */
    @Transactional
    public Account changeStatus(Long accountId, String status) {
        return changeStatus(accountId, AccountStatus.parse(status));
    }

    /**
     * Transactions the account sent or received, oldest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransactionHistory(Long accountId) {
        getAccount(accountId);
        return ledgerStore.transactionsFor(accountId);
    }

    @Transactional(readOnly = true)
    public boolean hasAccounts() {
        return accountRepository.count() > 0;
    }

    static String defaultCustomerName(Long customerId) {
        return "Customer " + customerId;
    }

    private static BigDecimal validateInitialBalance(BigDecimal initialBalance) {
        if (initialBalance == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        if (initialBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance cannot be negative");
        }
        if (initialBalance.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Initial balance must have at most 2 decimal places");
        }
        return initialBalance.setScale(2);
    }
}
