package com.flagship.transfer_ledger.transfer.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * The transfer would push the amount sent today past the daily limit.
 * Carries the three figures the decision was based on.
 */
@Getter
public class DailyLimitExceededException extends TransferException {

    private final BigDecimal limit;
    private final BigDecimal alreadyTransferred;
    private final BigDecimal attempted;

    public DailyLimitExceededException(BigDecimal limit, BigDecimal alreadyTransferred, BigDecimal attempted) {
        super(TransferErrorCode.DAILY_LIMIT_EXCEEDED,
            String.format("daily transfer limit exceeded: limit=%s, already_transferred_today=%s, attempting=%s",
                limit.toPlainString(), alreadyTransferred.toPlainString(), attempted.toPlainString()));
        this.limit = limit;
        this.alreadyTransferred = alreadyTransferred;
        this.attempted = attempted;
    }
}
