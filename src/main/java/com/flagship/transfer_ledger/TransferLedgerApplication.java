package com.flagship.transfer_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransferLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransferLedgerApplication.class, args);
    }
}
