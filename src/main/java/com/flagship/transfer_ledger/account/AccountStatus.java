package com.flagship.transfer_ledger.account;

import java.util.Locale;

/**
 * Account status enum.
 *
 * Status fields are not "just columns" - they have rules and constraints.
 * Transfers only ever ask whether an account is ACTIVE; the allowed
 * transitions below are enforced by the account lifecycle.
 */
public enum AccountStatus {
    /**
     * Account can send and receive funds.
     * Initial state for all accounts.
     */
    ACTIVE,

    /**
     * Account is temporarily blocked from sending and receiving funds.
     * Can be reactivated or closed.
     */
    FROZEN,

    /**
     * Account has been closed.
     * Terminal state - no further transitions allowed.
     */
    CLOSED;

    /**
     * Checks if a transition from this status to the target status is allowed.
     */
    public boolean canTransitionTo(AccountStatus targetStatus) {
        if (this == targetStatus) {
            return true; // Same status is always allowed (idempotent)
        }

        return switch (this) {
            case ACTIVE -> targetStatus == FROZEN || targetStatus == CLOSED;
            case FROZEN -> targetStatus == ACTIVE || targetStatus == CLOSED;
            case CLOSED -> false;
        };
    }

    /**
     * Parses a status name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static AccountStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Account status is required");
        }
        try {
            return AccountStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown account status: " + value);
        }
    }
}
