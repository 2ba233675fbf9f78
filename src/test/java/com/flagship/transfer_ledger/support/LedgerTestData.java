package com.flagship.transfer_ledger.support;

import com.flagship.transfer_ledger.account.Account;
import com.flagship.transfer_ledger.account.AccountService;
import com.flagship.transfer_ledger.account.NewAccountRequest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Opens accounts and reads ledger state straight from the database.
 * Every account gets a unique number, so test classes sharing one
 * in-memory database never collide.
 */
public final class LedgerTestData {

    private LedgerTestData() {
    }

    public static Account openAccount(AccountService accountService, String balance) {
        String accountNumber = "ACC-" + UUID.randomUUID().toString().substring(0, 12);
        return accountService.createAccount(NewAccountRequest.builder()
            .customerId(1000L)
            .accountNumber(accountNumber)
            .initialBalance(new BigDecimal(balance))
            .build());
    }

    public static BigDecimal balanceOf(JdbcTemplate jdbcTemplate, Long accountId) {
        return jdbcTemplate.queryForObject(
            "SELECT balance FROM accounts WHERE account_id = ?", BigDecimal.class, accountId);
    }

    public static int transactionsInvolving(JdbcTemplate jdbcTemplate, Long accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE from_account = ? OR to_account = ?",
            Integer.class, accountId, accountId);
        return count != null ? count : 0;
    }
}
