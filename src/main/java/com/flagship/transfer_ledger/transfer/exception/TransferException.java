package com.flagship.transfer_ledger.transfer.exception;

import lombok.Getter;

/**
 * Base class for every reason a transfer is rejected.
 *
 * All subclasses are request rejections: none of them is retried, and none
 * leaves a partial debit or credit behind.
 */
@Getter
public abstract class TransferException extends RuntimeException {

    private final TransferErrorCode errorCode;

    protected TransferException(TransferErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected TransferException(TransferErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
