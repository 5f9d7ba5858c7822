package com.automotiveiot.jdbcsink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Persists derivation units published by the event deriver.
 * 
 * Each unit (one speed snapshot plus the events derived from the same reading) is written
 * in a single transaction, with:
 * - Prometheus metrics for monitoring
 * - Retry of failed writes using the already-derived records
 * - Query access to stored snapshots and events
 */
@SpringBootApplication
public class JdbcSinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(JdbcSinkApplication.class, args);
    }
}
