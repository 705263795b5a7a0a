package com.flagship.club_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the club payments ledger service.
 *
 * Ingests signed notifications from the payment processor and maintains the
 * financial ledger of payments, refunds and disputes for receiving accounts.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ClubLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClubLedgerApplication.class, args);
    }
}
