package com.flagship.transfer_ledger.transfer.exception;

/**
 * The request itself is malformed: same source and destination, or a bad amount.
 */
public class InvalidTransferRequestException extends TransferException {

    public InvalidTransferRequestException(String message) {
        super(TransferErrorCode.INVALID_REQUEST, message);
    }
}
