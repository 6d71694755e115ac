package com.lendledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LendLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendLedgerApplication.class, args);
    }
}
