package com.flagship.erp_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ErpLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ErpLedgerApplication.class, args);
    }
}
