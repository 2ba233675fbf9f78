package com.flagship.transfer_ledger.transfer;

import com.flagship.transfer_ledger.ledger.LedgerTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of a committed transfer.
 */
@Value
public class TransferResult {
    Long transactionId;
    Long fromAccountId;
    Long toAccountId;
    BigDecimal amount;
    Instant createdAt;

    static TransferResult from(LedgerTransaction transaction) {
        return new TransferResult(
            transaction.getId(),
            transaction.getFromAccount(),
            transaction.getToAccount(),
            transaction.getAmount(),
            transaction.getCreatedAt()
        );
    }
}
