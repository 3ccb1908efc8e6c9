package com.flagship.bridge_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BridgeLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeLedgerApplication.class, args);
    }
}
