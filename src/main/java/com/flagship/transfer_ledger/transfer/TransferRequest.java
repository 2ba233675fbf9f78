package com.flagship.transfer_ledger.transfer;

import com.flagship.transfer_ledger.transfer.exception.InvalidTransferRequestException;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request object for moving funds between two accounts.
 *
 * Invariant: the amount is strictly positive, has at most two fractional
 * digits and fits NUMERIC(20,2).
 */
@Value
public class TransferRequest {

    static final int MAX_FRACTION_DIGITS = 2;
    static final int MAX_DIGITS = 20;

    long fromAccountId;
    long toAccountId;
    BigDecimal amount;

    private TransferRequest(long fromAccountId, long toAccountId, BigDecimal amount) {
        if (amount == null) {
            throw new InvalidTransferRequestException("Amount is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidTransferRequestException("Amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > MAX_FRACTION_DIGITS) {
            throw new InvalidTransferRequestException(
                "Amount must have at most " + MAX_FRACTION_DIGITS + " decimal places: " + amount.toPlainString());
        }
        BigDecimal normalized = amount.setScale(MAX_FRACTION_DIGITS);
        if (normalized.precision() > MAX_DIGITS) {
            throw new InvalidTransferRequestException(
                "Amount must have at most " + MAX_DIGITS + " digits: " + amount.toPlainString());
        }
        this.fromAccountId = fromAccountId;
        this.toAccountId = toAccountId;
        this.amount = normalized;
    }

    public static TransferRequest of(long fromAccountId, long toAccountId, BigDecimal amount) {
        return new TransferRequest(fromAccountId, toAccountId, amount);
    }

    public boolean isSelfTransfer() {
        return fromAccountId == toAccountId;
    }
}
