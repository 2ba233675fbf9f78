package com.flagship.transfer_ledger.transfer.exception;

import com.flagship.transfer_ledger.account.AccountStatus;
import lombok.Getter;

/**
 * The destination account is not ACTIVE and cannot receive funds.
 */
@Getter
public class AccountCannotReceiveException extends TransferException {

    private final Long accountId;
    private final AccountStatus status;

    public AccountCannotReceiveException(Long accountId, AccountStatus status) {
        super(TransferErrorCode.ACCOUNT_CANNOT_RECEIVE,
            String.format("destination account status '%s' cannot receive funds", status));
        this.accountId = accountId;
        this.status = status;
    }
}
