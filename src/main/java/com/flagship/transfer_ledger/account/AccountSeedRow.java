package com.flagship.transfer_ledger.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One raw row of the accounts seed file. Every cell is read as text and
 * converted by {@link AccountSeeder}, which decides how to treat bad values.
 */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountSeedRow {

    @JsonProperty("account_id")
    private String accountId;

    @JsonProperty("customer_id")
    private String customerId;

    @JsonProperty("account_number")
    private String accountNumber;

    @JsonProperty("account_type")
    private String accountType;

    @JsonProperty("balance")
    private String balance;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("status")
    private String status;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("customer_name")
    private String customerName;
}
