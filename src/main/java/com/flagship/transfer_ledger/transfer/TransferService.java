package com.flagship.transfer_ledger.transfer;

import com.flagship.transfer_ledger.account.Account;
import com.flagship.transfer_ledger.ledger.LedgerStore;
import com.flagship.transfer_ledger.ledger.LedgerTransaction;
import com.flagship.transfer_ledger.observability.CorrelationContext;
import com.flagship.transfer_ledger.observability.TransferMetrics;
import com.flagship.transfer_ledger.transfer.exception.AccountCannotReceiveException;
import com.flagship.transfer_ledger.transfer.exception.AccountInactiveException;
import com.flagship.transfer_ledger.transfer.exception.AccountNotFoundException;
import com.flagship.transfer_ledger.transfer.exception.DailyLimitExceededException;
import com.flagship.transfer_ledger.transfer.exception.InsufficientFundsException;
import com.flagship.transfer_ledger.transfer.exception.InvalidTransferRequestException;
import com.flagship.transfer_ledger.transfer.exception.TransferErrorCode;
import com.flagship.transfer_ledger.transfer.exception.TransferException;
import com.flagship.transfer_ledger.transfer.exception.TransferFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.function.Supplier;

/**
 * Moves funds between two accounts as one atomic unit.
 *
 * Checks, in order:
 * 1. Source and destination differ
 * 2. Both accounts exist (looked up while taking their row locks)
 * 3. Source is ACTIVE, then destination is ACTIVE
 * 4. Source balance covers the amount
 * 5. Amount sent today plus this amount stays within the daily limit
 *
 * Both row locks are taken in ascending account id order, whatever the
 * direction of the transfer, so A->B and B->A running together cannot deadlock.
 * Balances and the daily sum are read only after both locks are held.
 *
 * Every check failure rolls back before anything is written. A failure while
 * writing or committing rolls back the debit, the credit and the transaction
 * entry together and surfaces as TransferFailedException.
 */
@Service
@Slf4j
public class TransferService {

    private final LedgerStore ledgerStore;
    private final DailyLimitAggregator dailyLimitAggregator;
    private final TransactionTemplate transactionTemplate;
    private final TransferMetrics transferMetrics;
    private final Clock clock;
    private final BigDecimal dailyLimit;

    public TransferService(LedgerStore ledgerStore,
                           DailyLimitAggregator dailyLimitAggregator,
                           PlatformTransactionManager transactionManager,
                           TransferMetrics transferMetrics,
                           Clock clock,
                           @Value("${ledger.transfer.daily-limit:200000}") BigDecimal dailyLimit) {
        if (dailyLimit == null || dailyLimit.signum() <= 0) {
            throw new IllegalArgumentException("Daily transfer limit must be positive: " + dailyLimit);
        }
        this.ledgerStore = ledgerStore;
        this.dailyLimitAggregator = dailyLimitAggregator;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transferMetrics = transferMetrics;
        this.clock = clock;
        this.dailyLimit = dailyLimit;
        log.info("Transfer service ready: dailyLimit={}, zone={}", dailyLimit, dailyLimitAggregator.getZone());
    }

    /**
     * Transfers funds between two accounts.
     * Distinct accounts are checked before the amount.
     *
     * @throws InvalidTransferRequestException if the accounts are the same or the amount is invalid
     * @throws TransferException for every other rejection, see the subclasses
     */
    public TransferResult transfer(long fromAccountId, long toAccountId, BigDecimal amount) {
        return execute(fromAccountId, toAccountId, () -> TransferRequest.of(fromAccountId, toAccountId, amount));
    }

    /**
     * Transfers funds between two accounts.
     *
     * @param request validated transfer request
     * @return the committed transfer
     * @throws TransferException if the transfer is rejected; nothing has been written in that case
     */
    public TransferResult transfer(TransferRequest request) {
        return execute(request.getFromAccountId(), request.getToAccountId(), () -> request);
    }

    private TransferResult execute(long fromAccountId, long toAccountId, Supplier<TransferRequest> requestSupplier) {
        long startTime = System.currentTimeMillis();
        boolean ownsCorrelationId = CorrelationContext.openTransferScope(fromAccountId, toAccountId);

        try {
            if (fromAccountId == toAccountId) {
                throw new InvalidTransferRequestException("from_account and to_account must differ");
            }
            TransferRequest request = requestSupplier.get();
            log.info("Attempting transfer: amount={}", request.getAmount());

            TransferResult result = executeInTransaction(request);

            long duration = System.currentTimeMillis() - startTime;
            transferMetrics.recordTransferCompleted(result.getAmount().doubleValue(), duration);
            log.info("Transfer completed: transactionId={}, amount={}, duration={}ms",
                    result.getTransactionId(), result.getAmount(), duration);

            return result;

        } catch (TransferException e) {
            long duration = System.currentTimeMillis() - startTime;
            transferMetrics.recordTransferRejected(e.getErrorCode(), duration);
            if (e.getErrorCode() == TransferErrorCode.TRANSFER_FAILED) {
                log.error("Transfer failed and was rolled back: duration={}ms", duration, e);
            } else {
                log.warn("Transfer rejected: reason={}, message={}, duration={}ms",
                        e.getErrorCode(), e.getMessage(), duration);
            }
            throw e;
        } finally {
            CorrelationContext.closeTransferScope(ownsCorrelationId);
        }
    }

    public BigDecimal getDailyLimit() {
        return dailyLimit;
    }

    private TransferResult executeInTransaction(TransferRequest request) {
        try {
            return transactionTemplate.execute(status -> transferWithinTransaction(request));
        } catch (TransferException e) {
            throw e;
        } catch (RuntimeException e) {
            // store or commit failure; the template has already rolled back
            throw new TransferFailedException(e);
        }
    }

    private TransferResult transferWithinTransaction(TransferRequest request) {
        Long fromAccountId = request.getFromAccountId();
        Long toAccountId = request.getToAccountId();
        BigDecimal amount = request.getAmount();

        Account firstLocked = lockAccount(Math.min(fromAccountId, toAccountId));
        Account secondLocked = lockAccount(Math.max(fromAccountId, toAccountId));

        Account source = fromAccountId.equals(firstLocked.getAccountId()) ? firstLocked : secondLocked;
        Account destination = source == firstLocked ? secondLocked : firstLocked;

        if (!source.isActive()) {
            throw new AccountInactiveException(source.getAccountId(), source.getStatus());
        }
        if (!destination.isActive()) {
            throw new AccountCannotReceiveException(destination.getAccountId(), destination.getStatus());
        }
        if (source.getBalance().compareTo(amount) < 0) {
            throw new InsufficientFundsException(source.getAccountId(), source.getBalance(), amount);
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        BigDecimal transferredToday = dailyLimitAggregator.transferredToday(fromAccountId, now);
        if (transferredToday.add(amount).compareTo(dailyLimit) > 0) {
            throw new DailyLimitExceededException(dailyLimit, transferredToday, amount);
        }

        ledgerStore.save(source.debit(amount));
        ledgerStore.save(destination.credit(amount));
        LedgerTransaction recorded = ledgerStore.appendTransaction(
            LedgerTransaction.create(fromAccountId, toAccountId, amount, now));

        log.debug("Transfer staged: transactionId={}, sourceBalance={}, destinationBalance={}",
                recorded.getId(), source.getBalance().subtract(amount), destination.getBalance().add(amount));

        return TransferResult.from(recorded);
    }

    private Account lockAccount(long accountId) {
        return ledgerStore.getForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }
}
