package com.flagship.transfer_ledger.transfer.exception;

/**
 * Stable reason codes for rejected transfers.
 * Used as metric tags and for callers that branch on the failure kind.
 */
public enum TransferErrorCode {
    INVALID_REQUEST,
    ACCOUNT_NOT_FOUND,
    ACCOUNT_INACTIVE,
    ACCOUNT_CANNOT_RECEIVE,
    INSUFFICIENT_FUNDS,
    DAILY_LIMIT_EXCEEDED,
    TRANSFER_FAILED
}
