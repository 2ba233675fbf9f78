package com.flagship.transfer_ledger.observability;

import com.flagship.transfer_ledger.transfer.exception.TransferErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for transfer operations.
 *
 * Metrics exposed:
 * - transfers.completed: Counter of committed transfers
 * - transfers.rejected: Counter of rejected transfers, tagged by reason
 * - transfers.latency: Timer for transfer operations, tagged by outcome
 * - transfers.amount: Distribution of committed amounts
 */
@Component
public class TransferMetrics {

    private final MeterRegistry registry;

    private final Counter transfersCompleted;
    private final DistributionSummary transferAmounts;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.transfersCompleted = Counter.builder("transfers.completed")
                .description("Number of committed transfers")
                .register(registry);

        this.transferAmounts = DistributionSummary.builder("transfers.amount")
                .description("Amounts moved by committed transfers")
                .register(registry);
    }

    /**
     * Records a committed transfer and how long it took.
     */
    public void recordTransferCompleted(double amount, long durationMs) {
        transfersCompleted.increment();
        transferAmounts.record(amount);
        recordLatency("completed", durationMs);
    }

    /**
     * Records a rejected transfer.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordTransferRejected(TransferErrorCode reason, long durationMs) {
        registry.counter("transfers.rejected",
                "reason", sanitizeTag(reason != null ? reason.name() : null)
        ).increment();
        recordLatency("rejected", durationMs);
    }

    private void recordLatency(String outcome, long durationMs) {
        registry.timer("transfers.latency",
                "outcome", outcome
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
