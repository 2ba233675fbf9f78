package com.flagship.transfer_ledger.account;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request object for opening an account.
 * Unset optional fields fall back to the lifecycle defaults.
 */
@Value
@Builder
public class NewAccountRequest {
    Long customerId;
    String accountNumber;
    String accountType;
    BigDecimal initialBalance;
    String currency;
    String customerName;
}
