package com.flagship.store_credit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StoreCreditLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoreCreditLedgerApplication.class, args);
    }
}
