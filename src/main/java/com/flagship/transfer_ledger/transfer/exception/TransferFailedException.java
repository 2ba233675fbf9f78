package com.flagship.transfer_ledger.transfer.exception;

/**
 * The store failed while the transfer was being applied or committed.
 * The whole unit of work has been rolled back when this is thrown.
 */
public class TransferFailedException extends TransferException {

    public TransferFailedException(Throwable cause) {
        super(TransferErrorCode.TRANSFER_FAILED, "transfer failed: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
