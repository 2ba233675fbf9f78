package com.flagship.transfer_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC scope for a single transfer.
 *
 * Every log line written while a transfer runs carries a correlation ID and
 * the two account IDs. A correlation ID already present in the MDC (set by a
 * caller) is reused, otherwise a short one is generated for the transfer.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String FROM_ACCOUNT_ID_MDC_KEY = "fromAccountId";
    public static final String TO_ACCOUNT_ID_MDC_KEY = "toAccountId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Opens the transfer scope on the current thread.
     *
     * @return true if this call generated the correlation ID and must remove it on close
     */
    public static boolean openTransferScope(long fromAccountId, long toAccountId) {
        boolean generated = false;
        String correlationId = MDC.get(CORRELATION_ID_MDC_KEY);
        if (correlationId == null || correlationId.isBlank()) {
            MDC.put(CORRELATION_ID_MDC_KEY, generateCorrelationId());
            generated = true;
        }
        MDC.put(FROM_ACCOUNT_ID_MDC_KEY, String.valueOf(fromAccountId));
        MDC.put(TO_ACCOUNT_ID_MDC_KEY, String.valueOf(toAccountId));
        return generated;
    }

    /**
     * Closes the transfer scope, leaving a caller-provided correlation ID in place.
     */
    public static void closeTransferScope(boolean removeCorrelationId) {
        MDC.remove(FROM_ACCOUNT_ID_MDC_KEY);
        MDC.remove(TO_ACCOUNT_ID_MDC_KEY);
        if (removeCorrelationId) {
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
