package com.hostpanel.orchestrator.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool that runs jobs in the background.
 *
 * A fixed pool caps how many jobs talk to hypervisors at once; each worker
 * runs one job at a time, its targets sequentially.
 */
@Configuration
@EnableScheduling
public class JobExecutorConfig {

    @Bean(name = "jobExecutor", destroyMethod = "shutdown")
    public ExecutorService jobExecutor(@Value("${hostpanel.jobs.worker-count:4}") int workerCount) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        });
    }
}
