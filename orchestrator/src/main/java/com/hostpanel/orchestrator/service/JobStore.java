package com.hostpanel.orchestrator.service;

import com.hostpanel.orchestrator.model.Job;
import com.hostpanel.orchestrator.model.JobKind;
import com.hostpanel.orchestrator.model.JobRecord;
import com.hostpanel.orchestrator.model.JobStatus;
import com.hostpanel.orchestrator.repository.JobRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Write-through cache of Job snapshots over the jobs table.
 *
 * The database is the source of truth. Every mutation is applied under a
 * per-job lock, written to the database first and only then published to the
 * cache, so a crash between the two leaves the durable record authoritative.
 * A cache miss falls back to the durable record (reconciliation) and
 * re-populates the cache.
 *
 * Cached values are immutable {@link Job} records; readers never see a
 * half-applied mutation.
 */
@Component
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final JobRecordRepository repo;
    private final Duration            retention;

    private final Map<String, Job>    cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public JobStore(JobRecordRepository repo,
                    @Value("${hostpanel.jobs.cache-retention-minutes:30}") long retentionMinutes) {
        this.repo      = repo;
        this.retention = Duration.ofMinutes(retentionMinutes);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /** Persist a new job, then cache it. */
    public Job create(Job job) {
        repo.save(JobRecord.from(job));
        cache.put(job.id(), job);
        return job;
    }

    /**
     * Apply {@code mutation} to the current snapshot of a job.
     *
     * The mutation may throw to veto the change; nothing is written in that
     * case. Returning the same instance is treated as "no change".
     *
     * @throws JobException NOT_FOUND if the job is unknown to both cache and database
     */
    public Job update(String jobId, UnaryOperator<Job> mutation) {
        synchronized (lockFor(jobId)) {
            Job current = find(jobId).orElseThrow(() -> JobException.notFound("Job", jobId));
            Job next = mutation.apply(current);
            if (next == current) {
                return current;
            }
            repo.save(JobRecord.from(next));   // durable first
            cache.put(jobId, next);
            return next;
        }
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** Cache first; on a miss rebuild the snapshot from the durable record. */
    public Optional<Job> find(String jobId) {
        Job cached = cache.get(jobId);
        if (cached != null) {
            return Optional.of(cached);
        }
        return repo.findById(jobId).map(record -> {
            Job rebuilt = record.toJob();
            log.debug("Job {} rebuilt from durable record ({}, {}%)",
                    jobId, rebuilt.status(), rebuilt.progress());
            Job raced = cache.putIfAbsent(jobId, rebuilt);
            return raced != null ? raced : rebuilt;
        });
    }

    /** Newest first, straight from the database. */
    public List<Job> list(JobKind kind, JobStatus status) {
        List<JobRecord> records;
        if (kind != null && status != null) {
            records = repo.findByKindAndStatusOrderByCreatedAtDesc(kind, status);
        } else if (kind != null) {
            records = repo.findByKindOrderByCreatedAtDesc(kind);
        } else if (status != null) {
            records = repo.findByStatusOrderByCreatedAtDesc(status);
        } else {
            records = repo.findAllByOrderByCreatedAtDesc();
        }
        return records.stream().map(r -> cache.getOrDefault(r.getId(), r.toJob())).toList();
    }

    /** Ids of jobs created before {@code createdBefore} that the database still records as PENDING or RUNNING. */
    public List<String> findUnfinishedIds(Instant createdBefore) {
        return repo.findByStatusIn(List.of(JobStatus.PENDING, JobStatus.RUNNING)).stream()
                .filter(r -> r.getCreatedAt() != null && r.getCreatedAt().isBefore(createdBefore))
                .map(JobRecord::getId)
                .toList();
    }

    // ------------------------------------------------------------------
    // Cache maintenance
    // ------------------------------------------------------------------

    /** Drop every cached snapshot; the next read reconciles from the database. */
    public void clearCache() {
        cache.clear();
    }

    /**
     * Evict terminal jobs that finished more than the retention window ago.
     * They stay readable through the durable record.
     */
    @Scheduled(fixedDelayString = "${hostpanel.jobs.cache-sweep-ms:60000}")
    public void evictFinished() {
        Instant cutoff = Instant.now().minus(retention);
        int evicted = 0;
        for (Job job : cache.values()) {
            if (job.status().isTerminal()
                    && job.completedAt() != null
                    && job.completedAt().isBefore(cutoff)
                    && cache.remove(job.id(), job)) {
                locks.remove(job.id());
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} finished jobs from the cache", evicted);
        }
    }

    int cachedCount() {
        return cache.size();
    }

    private Object lockFor(String jobId) {
        return locks.computeIfAbsent(jobId, k -> new Object());
    }
}
