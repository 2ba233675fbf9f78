package com.flagship.transfer_ledger.transfer;

import com.flagship.transfer_ledger.transfer.exception.InvalidTransferRequestException;
import com.flagship.transfer_ledger.transfer.exception.TransferErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TransferRequestTest {

    @Test
    @DisplayName("Valid amount is normalized to two decimal places")
    void testValidRequest() {
        TransferRequest request = TransferRequest.of(1L, 2L, new BigDecimal("100.5"));

        assertEquals(new BigDecimal("100.50"), request.getAmount());
        assertEquals(1L, request.getFromAccountId());
        assertEquals(2L, request.getToAccountId());
        assertFalse(request.isSelfTransfer());
    }

    @Test
    @DisplayName("Trailing zeros beyond two decimals are accepted")
    void testTrailingZeros() {
        TransferRequest request = TransferRequest.of(1L, 2L, new BigDecimal("7.1000"));

        assertEquals(new BigDecimal("7.10"), request.getAmount());
    }

    @Test
    @DisplayName("Zero, negative and missing amounts are rejected")
    void testNonPositiveAmount_ShouldFail() {
        assertThrows(InvalidTransferRequestException.class, () -> TransferRequest.of(1L, 2L, BigDecimal.ZERO));
        assertThrows(InvalidTransferRequestException.class, () -> TransferRequest.of(1L, 2L, new BigDecimal("-0.01")));
        assertThrows(InvalidTransferRequestException.class, () -> TransferRequest.of(1L, 2L, null));
    }

    @Test
    @DisplayName("More than two significant decimal places are rejected")
    void testTooManyDecimals_ShouldFail() {
        InvalidTransferRequestException exception = assertThrows(InvalidTransferRequestException.class,
            () -> TransferRequest.of(1L, 2L, new BigDecimal("0.001")));

        assertEquals(TransferErrorCode.INVALID_REQUEST, exception.getErrorCode());
        assertTrue(exception.getMessage().contains("decimal places"));
    }

    @Test
    @DisplayName("Amounts wider than NUMERIC(20,2) are rejected")
    void testTooManyDigits_ShouldFail() {
        assertThrows(InvalidTransferRequestException.class,
            () -> TransferRequest.of(1L, 2L, new BigDecimal("1234567890123456789")));

        TransferRequest widest = TransferRequest.of(1L, 2L, new BigDecimal("123456789012345678.99"));
        assertEquals(20, widest.getAmount().precision());
    }

    @Test
    @DisplayName("Same source and destination is flagged as self transfer")
    void testSelfTransfer() {
        assertTrue(TransferRequest.of(5L, 5L, BigDecimal.ONE).isSelfTransfer());
    }
}
