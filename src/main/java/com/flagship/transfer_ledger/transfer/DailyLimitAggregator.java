package com.flagship.transfer_ledger.transfer;

import com.flagship.transfer_ledger.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * Computes how much an account has already sent in the current calendar day.
 *
 * The day runs from midnight (inclusive) to the next midnight (exclusive) in
 * a single configured zone, UTC unless ledger.transfer.zone says otherwise.
 * Results are never cached: the sum must include transfers committed a moment ago.
 */
@Component
@Slf4j
public class DailyLimitAggregator {

    private final LedgerStore ledgerStore;
    private final ZoneId zone;

    public DailyLimitAggregator(LedgerStore ledgerStore,
                                @Value("${ledger.transfer.zone:UTC}") ZoneId zone) {
        this.ledgerStore = ledgerStore;
        this.zone = zone;
    }

    /**
     * @param accountId sending account
     * @param now the instant whose calendar day is summed
     * @return total sent today, never negative
     */
    public BigDecimal transferredToday(Long accountId, Instant now) {
        LocalDate day = now.atZone(zone).toLocalDate();
        Instant windowStart = day.atStartOfDay(zone).toInstant();
        // inclusive end, at the microsecond precision of stored timestamps
        Instant windowEnd = day.plusDays(1).atStartOfDay(zone).toInstant().minus(1, ChronoUnit.MICROS);

        BigDecimal sent = ledgerStore.sumSentSince(accountId, windowStart, windowEnd);
        log.debug("Amount sent today: accountId={}, day={}, sent={}", accountId, day, sent);
        return sent != null ? sent : BigDecimal.ZERO;
    }

    public ZoneId getZone() {
        return zone;
    }
}
