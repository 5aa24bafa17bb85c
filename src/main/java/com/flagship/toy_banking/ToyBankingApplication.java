package com.flagship.toy_banking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of a single bank-service instance.
 *
 * Each running process owns a disjoint set of accounts and takes part in the
 * transfer protocol both as coordinator (outgoing transfers) and as participant
 * (incoming transfers).
 */
@SpringBootApplication
@EnableScheduling
public class ToyBankingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToyBankingApplication.class, args);
    }
}
