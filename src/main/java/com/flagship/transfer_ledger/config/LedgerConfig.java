package com.flagship.transfer_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core ledger beans.
 *
 * Transaction timestamps and the daily limit window both read this clock,
 * which keeps them on the same time line (UTC).
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
