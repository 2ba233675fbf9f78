package com.flagship.transfer_ledger.account;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds the ledger from a CSV file on startup.
 *
 * Runs only when the file exists and the accounts table is empty.
 * Expected header: account_id, customer_id, account_number, account_type,
 * balance, currency, status, created_at, customer_name.
 *
 * A row whose optional cells (account_type, created_at) cannot be read is
 * loaded with defaults instead. A row without a usable account_id, balance or
 * status aborts the whole seed.
 */
@Component
@ConditionalOnProperty(name = "ledger.seed.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class AccountSeeder implements ApplicationRunner {

    static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final AccountService accountService;
    private final CsvMapper csvMapper;
    private final Clock clock;
    private final Path csvPath;

    public AccountSeeder(AccountService accountService,
                         CsvMapper csvMapper,
                         Clock clock,
                         @Value("${ledger.seed.csv-path:accounts.csv}") Path csvPath) {
        this.accountService = accountService;
        this.csvMapper = csvMapper;
        this.clock = clock;
        this.csvPath = csvPath;
    }

    @Override
    public void run(ApplicationArguments args) {
        seed();
    }

    /**
     * @return number of accounts seeded
     */
    public int seed() {
        if (!Files.exists(csvPath)) {
            log.info("No seed file at {}, skipping seed", csvPath.toAbsolutePath());
            return 0;
        }
        if (accountService.hasAccounts()) {
            log.info("Ledger already has accounts, skipping seed from {}", csvPath);
            return 0;
        }

        List<Account> accounts = readAccounts();
        return accountService.seedAccounts(accounts);
    }

    List<Account> readAccounts() {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Account> accounts = new ArrayList<>();

        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             MappingIterator<AccountSeedRow> rows = csvMapper.readerFor(AccountSeedRow.class)
                 .with(schema)
                 .readValues(reader)) {
            int line = 1;
            while (rows.hasNext()) {
                line++;
                accounts.add(toAccount(rows.next(), line));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed file " + csvPath, e);
        }

        log.debug("Read {} accounts from {}", accounts.size(), csvPath);
        return accounts;
    }

    Account toAccount(AccountSeedRow row, int line) {
        Long accountId = parseRequiredLong(row.getAccountId(), "account_id", line);
        Long customerId = parseOptionalLong(row.getCustomerId(), "customer_id", line);
        BigDecimal balance = parseBalance(row.getBalance(), line);
        String currency = isBlank(row.getCurrency()) ? AccountService.DEFAULT_CURRENCY : row.getCurrency().trim();
        AccountStatus status = isBlank(row.getStatus()) ? AccountStatus.ACTIVE : AccountStatus.parse(row.getStatus());

        Instant createdAt = parseCreatedAt(row.getCreatedAt(), line);
        if (createdAt == null) {
            log.warn("Seed line {} has no readable created_at, loading minimal account {}", line, accountId);
            return new Account(accountId, customerId, row.getAccountNumber(), null, currency,
                AccountService.defaultCustomerName(customerId), balance, status, clock.instant());
        }

        String customerName = isBlank(row.getCustomerName())
            ? AccountService.defaultCustomerName(customerId)
            : row.getCustomerName().trim();
        return new Account(accountId, customerId, row.getAccountNumber(), blankToNull(row.getAccountType()),
            currency, customerName, balance, status, createdAt);
    }

    private static Instant parseCreatedAt(String value, int line) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), CREATED_AT_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Seed line {}: unreadable created_at '{}': {}", line, value, e.getMessage());
            return null;
        }
    }

    private static Long parseRequiredLong(String value, String column, int line) {
        if (isBlank(value)) {
            throw new IllegalArgumentException("Seed line " + line + ": " + column + " is required");
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Seed line " + line + ": invalid " + column + " '" + value + "'", e);
        }
    }

    private static Long parseOptionalLong(String value, String column, int line) {
        return isBlank(value) ? 0L : parseRequiredLong(value, column, line);
    }

    private static BigDecimal parseBalance(String value, int line) {
        if (isBlank(value)) {
            return BigDecimal.ZERO.setScale(2);
        }
        BigDecimal balance;
        try {
            balance = new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Seed line " + line + ": invalid balance '" + value + "'", e);
        }
        if (balance.signum() < 0) {
            throw new IllegalArgumentException("Seed line " + line + ": balance cannot be negative");
        }
        if (balance.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Seed line " + line + ": balance has more than 2 decimal places");
        }
        return balance.setScale(2, RoundingMode.UNNECESSARY);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
