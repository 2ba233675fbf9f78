package com.flagship.transfer_ledger.observability;

import com.flagship.transfer_ledger.ledger.AccountRepository;
import com.flagship.transfer_ledger.transfer.TransferService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the ledger store.
 * Down when the accounts table cannot be queried.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final AccountRepository accountRepository;
    private final TransferService transferService;

    public LedgerHealthIndicator(AccountRepository accountRepository, TransferService transferService) {
        this.accountRepository = accountRepository;
        this.transferService = transferService;
    }

    @Override
    public Health health() {
        try {
            long accounts = accountRepository.count();
            return Health.up()
                    .withDetail("accounts", accounts)
                    .withDetail("dailyTransferLimit", transferService.getDailyLimit().toPlainString())
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
