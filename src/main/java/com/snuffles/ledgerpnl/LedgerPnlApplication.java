package com.snuffles.ledgerpnl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LedgerPnlApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerPnlApplication.class, args);
    }
}
