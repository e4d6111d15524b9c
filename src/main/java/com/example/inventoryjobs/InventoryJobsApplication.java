package com.example.inventoryjobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Inventory Jobs Application
 * <p>
 * Background job execution core of the inventory backend: a PostgreSQL-backed
 * task queue with weighted queues, retries and cron schedules, and the processors
 * that run on it.
 * <p>
 * Features:
 * - Ambient JDBC transactions shared by nested units of work
 * - Weighted queue polling with a bounded worker pool
 * - Linear retry backoff and dead-lettering
 * - Cluster-wide cron fan-out through ShedLock
 * - Loan/repair reminders, retention cleanup and thumbnail generation
 */
@EnableScheduling
@SpringBootApplication
public class InventoryJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryJobsApplication.class, args);
    }
}
