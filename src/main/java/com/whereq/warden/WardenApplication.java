package com.whereq.warden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Warden.
 * Runs pluggable probes against remote targets with dependency-aware scheduling,
 * retries, timeouts and pooled connections, and aggregates the results.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class WardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(WardenApplication.class, args);
    }
}
