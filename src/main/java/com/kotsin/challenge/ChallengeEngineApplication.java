package com.kotsin.challenge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

/**
 * Order lifecycle and risk engine for a funded trading account.
 *
 * Queues externally generated signals, places and sizes entries, manages partial exits with a
 * ratcheting stop and enforces the account's drawdown limits. State is checkpointed to Redis and
 * reconciled against the venue on startup.
 */
@SpringBootApplication
@EnableCaching
public class ChallengeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChallengeEngineApplication.class, args);
    }
}
