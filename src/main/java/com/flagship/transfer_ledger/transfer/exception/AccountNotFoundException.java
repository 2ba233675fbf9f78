package com.flagship.transfer_ledger.transfer.exception;

import lombok.Getter;

@Getter
public class AccountNotFoundException extends TransferException {

    private final Long accountId;

    public AccountNotFoundException(Long accountId) {
        super(TransferErrorCode.ACCOUNT_NOT_FOUND,
            "source or destination account not found: accountId=" + accountId);
        this.accountId = accountId;
    }
}
