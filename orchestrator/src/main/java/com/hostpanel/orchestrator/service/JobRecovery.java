package com.hostpanel.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Reconciles the jobs table with reality once the application is up:
 * anything still PENDING or RUNNING that was created before this bean
 * belonged to a worker of the previous process.
 *
 * The cut-off is taken when the bean is constructed, which happens before
 * the web server accepts submissions, so jobs submitted to this process are
 * never reconciled.
 */
@Component
public class JobRecovery {

    private static final Logger log = LoggerFactory.getLogger(JobRecovery.class);

    private final JobService jobService;
    private final Instant    bootedAt;

    public JobRecovery(JobService jobService) {
        this.jobService = jobService;
        this.bootedAt   = Instant.now();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        int recovered = jobService.recoverInterruptedJobs(bootedAt);
        if (recovered > 0) {
            log.warn("Finalized {} jobs interrupted by the previous shutdown", recovered);
        }
    }
}
