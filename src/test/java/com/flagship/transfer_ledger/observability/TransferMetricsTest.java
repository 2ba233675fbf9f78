package com.flagship.transfer_ledger.observability;

import com.flagship.transfer_ledger.transfer.exception.TransferErrorCode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TransferMetricsTest {

    private SimpleMeterRegistry registry;
    private TransferMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TransferMetrics(registry);
    }

    @Test
    @DisplayName("Completed transfer updates count, amount and latency")
    void testRecordCompleted() {
        metrics.recordTransferCompleted(125.50, 40);
        metrics.recordTransferCompleted(74.50, 20);

        assertEquals(2.0, registry.counter("transfers.completed").count());
        assertEquals(200.0, registry.get("transfers.amount").summary().totalAmount());
        assertEquals(2, registry.get("transfers.latency").tag("outcome", "completed").timer().count());
        assertEquals(60.0, registry.get("transfers.latency").tag("outcome", "completed").timer()
            .totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("Rejections are counted per reason")
    void testRecordRejected() {
        metrics.recordTransferRejected(TransferErrorCode.INSUFFICIENT_FUNDS, 5);
        metrics.recordTransferRejected(TransferErrorCode.INSUFFICIENT_FUNDS, 5);
        metrics.recordTransferRejected(TransferErrorCode.DAILY_LIMIT_EXCEEDED, 5);
        metrics.recordTransferRejected(null, 5);

        assertEquals(2.0, registry.counter("transfers.rejected", "reason", "INSUFFICIENT_FUNDS").count());
        assertEquals(1.0, registry.counter("transfers.rejected", "reason", "DAILY_LIMIT_EXCEEDED").count());
        assertEquals(1.0, registry.counter("transfers.rejected", "reason", "unknown").count());
        assertEquals(4, registry.get("transfers.latency").tag("outcome", "rejected").timer().count());
        assertEquals(0.0, registry.counter("transfers.completed").count());
    }
}
