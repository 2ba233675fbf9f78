package com.flagship.transfer_ledger.transfer.exception;

import com.flagship.transfer_ledger.account.AccountStatus;
import lombok.Getter;

/**
 * The source account is not ACTIVE and cannot send funds.
 */
@Getter
public class AccountInactiveException extends TransferException {

    private final Long accountId;
    private final AccountStatus status;

    public AccountInactiveException(Long accountId, AccountStatus status) {
        super(TransferErrorCode.ACCOUNT_INACTIVE,
            String.format("source account status '%s' cannot transact", status));
        this.accountId = accountId;
        this.status = status;
    }
}
