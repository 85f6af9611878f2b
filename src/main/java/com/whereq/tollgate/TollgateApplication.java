package com.whereq.tollgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Tollgate.
 * This service admits, prices and schedules jobs for a pool of expensive, rate-limited
 * AI workers under hard spend and concurrency ceilings.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class TollgateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TollgateApplication.class, args);
    }
}
