package com.aistudio.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic housekeeping for the in-memory job registry.
 *
 * Every minute it fails running jobs past their deadline; every hour it drops
 * finished jobs older than the retention window so the registry stays bounded.
 */
@Component
@EnableScheduling
public class JobMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobMaintenanceScheduler.class);

    private final JobQueueManager jobs;
    private final Duration        retention;

    public JobMaintenanceScheduler(JobQueueManager jobs,
                                   @Value("${ai-studio.jobs.retention-hours:24}") long retentionHours) {
        this.jobs      = jobs;
        this.retention = Duration.ofHours(retentionHours);
    }

    @Scheduled(fixedDelay = 60_000, initialDelay = 60_000)
    public void expireOverdueJobs() {
        int expired = jobs.expireOverdueJobs();
        if (expired > 0) {
            log.warn("Failed {} jobs that ran past their deadline", expired);
        }
    }

    @Scheduled(fixedDelay = 3_600_000, initialDelay = 3_600_000)
    public void cleanupOldJobs() {
        int removed = jobs.cleanupOldJobs(retention);
        log.debug("Retention sweep removed {} jobs (retention={}h)", removed, retention.toHours());
    }
}
