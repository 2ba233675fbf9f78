package com.flagship.transfer_ledger.transfer.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends TransferException {

    private final Long accountId;
    private final BigDecimal balance;
    private final BigDecimal attempted;

    public InsufficientFundsException(Long accountId, BigDecimal balance, BigDecimal attempted) {
        super(TransferErrorCode.INSUFFICIENT_FUNDS,
            String.format("insufficient funds: accountId=%d, balance=%s, attempting=%s",
                accountId, balance.toPlainString(), attempted.toPlainString()));
        this.accountId = accountId;
        this.balance = balance;
        this.attempted = attempted;
    }
}
