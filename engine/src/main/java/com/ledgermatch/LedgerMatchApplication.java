package com.ledgermatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerMatchApplication.class, args);
    }
}
