package com.hostpanel.orchestrator.service;

import com.hostpanel.orchestrator.model.*;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Core business logic for the job lifecycle.
 *
 * submit() records a PENDING job and hands run() to the background executor;
 * run() drives the job's {@link JobPipeline} over its targets one after the
 * other. Distinct jobs run in parallel on the executor, targets of one job
 * never do. All state goes through {@link JobStore}.
 *
 * Metrics:
 * <pre>
 *   hostpanel.job.duration{kind, status}
 *   hostpanel.job.targets{kind, status}
 * </pre>
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final String CANCELLED_BY_USER      = "Cancelled by user";
    static final String INTERRUPTED_BY_RESTART = "Interrupted by orchestrator restart";

    private final JobStore                   store;
    private final Map<JobKind, JobPipeline>  pipelines = new EnumMap<>(JobKind.class);
    private final Executor                   jobExecutor;
    private final MeterRegistry              meterRegistry;

    public JobService(JobStore store,
                      List<JobPipeline> allPipelines,
                      @Qualifier("jobExecutor") Executor jobExecutor,
                      MeterRegistry meterRegistry) {
        this.store         = store;
        this.jobExecutor   = jobExecutor;
        this.meterRegistry = meterRegistry;
        for (JobPipeline pipeline : allPipelines) {
            JobPipeline previous = pipelines.put(pipeline.kind(), pipeline);
            if (previous != null) {
                throw new IllegalStateException("Two pipelines registered for " + pipeline.kind());
            }
            log.info("Registered {} pipeline {}", pipeline.kind(), pipeline.getClass().getSimpleName());
        }
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate and durably record a new job, then schedule it.
     *
     * Returns as soon as the PENDING record is written; execution continues
     * on the job executor.
     *
     * @throws JobException INVALID_INPUT for an empty, blank or duplicated
     *                      target list, or parameters the pipeline rejects
     */
    public Job submit(JobKind kind, List<String> targetIds, Map<String, Object> parameters) {
        if (kind == null) {
            throw JobException.invalidInput("Job kind is required");
        }
        JobPipeline pipeline = pipelines.get(kind);
        if (pipeline == null) {
            throw JobException.invalidInput("No pipeline registered for job kind " + kind);
        }
        validateTargets(targetIds);
        Map<String, Object> effective = pipeline.validate(targetIds, parameters == null ? Map.of() : parameters);

        Job job = store.create(Job.pending(kind, targetIds, effective));
        log.info("Job {} submitted: kind={}, targets={}", job.id(), kind, targetIds.size());

        try {
            jobExecutor.execute(() -> runSafely(job.id()));
        } catch (RejectedExecutionException e) {
            log.error("Job {} could not be scheduled", job.id(), e);
            return store.update(job.id(), j -> j.status().isTerminal() ? j : j.aborted("Job could not be scheduled: " + e.getMessage()));
        }
        return job;
    }

    // ------------------------------------------------------------------
    // Execution (called on a job executor thread)
    // ------------------------------------------------------------------

    /**
     * Execute a job to completion.
     *
     * Steps:
     *  1. PENDING → RUNNING (a job cancelled before it started is left alone)
     *  2. pipeline.open(): job-level setup; failure aborts the job
     *  3. each target in order; a failing target is recorded and the loop continues
     *  4. cancellation is checked before every target
     *  5. cleanup, then the terminal status derived from the target outcomes
     */
    public void run(String jobId) {
        Job job = store.update(jobId, j -> j.status() == JobStatus.PENDING ? j.started() : j);
        if (job.status() != JobStatus.RUNNING) {
            log.info("Job {} not started: status is {}", jobId, job.status());
            return;
        }

        JobPipeline pipeline = pipelines.get(job.kind());
        Timer.Sample sample = Timer.start(meterRegistry);

        PipelineRun execution;
        try {
            execution = pipeline.open(job);
        } catch (Exception e) {
            log.error("Job {} aborted during setup: {}", jobId, e.getMessage(), e);
            Job aborted = store.update(jobId, j -> j.status().isTerminal() ? j : j.aborted(describe(e)));
            recordMetrics(aborted, sample);
            return;
        }

        int base = Math.max(0, Math.min(99, pipeline.setupWeight()));
        store.update(jobId, j -> j.withProgress(base));

        int count = job.targets().size();
        try {
            for (int i = 0; i < count; i++) {
                if (store.find(jobId).map(j -> j.status() == JobStatus.CANCELLED).orElse(false)) {
                    log.info("Job {} cancelled, {} of {} targets not started", jobId, count - i, count);
                    break;
                }
                final int index = i;
                TargetResult result = processTarget(execution, jobId, index);
                int progress = progressAfter(base, index, count);
                store.update(jobId, j -> j.withTarget(index, result).withProgress(progress));
            }
        } finally {
            closeQuietly(execution, jobId);
        }

        Job done = store.update(jobId, j -> j.status().isTerminal() ? j : j.finished());
        log.info("Job {} {}: {} succeeded, {} failed, {} skipped",
                jobId, done.status(),
                done.countTargets(TargetStatus.SUCCESS),
                done.countTargets(TargetStatus.FAILED),
                done.countTargets(TargetStatus.SKIPPED));
        recordMetrics(done, sample);
    }

    // ------------------------------------------------------------------
    // Polling / cancellation
    // ------------------------------------------------------------------

    /** @throws JobException NOT_FOUND if neither cache nor database knows the id */
    public Job getStatus(String jobId) {
        return store.find(jobId).orElseThrow(() -> JobException.notFound("Job", jobId));
    }

    public List<Job> list(JobKind kind, JobStatus status) {
        return store.list(kind, status);
    }

    /**
     * Flag a PENDING or RUNNING job as CANCELLED.
     *
     * A remote call already in flight for the current target is not
     * interrupted; the runner stops at the next target boundary and targets
     * already processed keep their outcomes.
     *
     * @throws JobException ALREADY_TERMINAL (record unchanged) or NOT_FOUND
     */
    public Job cancel(String jobId) {
        Job cancelled = store.update(jobId, j -> {
            if (j.status().isTerminal()) {
                throw new JobException(JobException.Kind.ALREADY_TERMINAL,
                        "Job " + jobId + " is already " + j.status());
            }
            return j.cancelled(CANCELLED_BY_USER);
        });
        log.info("Job {} cancelled", jobId);
        return cancelled;
    }

    /**
     * Finalize jobs whose worker died with the previous process.
     *
     * Called once at startup. Only jobs created before {@code bootedAt} are
     * touched; anything newer was submitted to this process and still has a
     * worker. Target results recorded so far are kept so the caller can
     * resubmit only what did not finish.
     *
     * @return number of jobs finalized
     */
    public int recoverInterruptedJobs(Instant bootedAt) {
        List<String> unfinished = store.findUnfinishedIds(bootedAt);
        for (String jobId : unfinished) {
            store.update(jobId, j -> j.status().isTerminal() ? j : j.aborted(INTERRUPTED_BY_RESTART));
            log.warn("Job {} was interrupted by a restart and has been marked FAILED", jobId);
        }
        return unfinished.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** floor(base + (i+1) * ((100 - base) / count)). */
    static int progressAfter(int base, int index, int count) {
        return (int) Math.floor(base + (index + 1) * ((100.0 - base) / count));
    }

    private TargetResult processTarget(PipelineRun execution, String jobId, int index) {
        String targetId = store.find(jobId).orElseThrow().targets().get(index).targetId();
        TargetContext ctx = new TargetContext(jobId, index, targetId, (stage, message) ->
                store.update(jobId, j -> j.withTarget(index, j.targets().get(index).atStage(stage, message))));
        try {
            TargetOutcome outcome = execution.processTarget(ctx);
            return outcome.applyTo(currentTarget(jobId, index));
        } catch (Exception e) {
            TargetResult current = currentTarget(jobId, index);
            log.error("Job {} target {} failed at stage {}: {}",
                    jobId, targetId, current.stage(), e.getMessage(), e);
            return current.failed(describe(e));
        }
    }

    private TargetResult currentTarget(String jobId, int index) {
        return store.find(jobId).orElseThrow().targets().get(index);
    }

    private static void validateTargets(List<String> targetIds) {
        if (targetIds == null || targetIds.isEmpty()) {
            throw JobException.invalidInput("At least one target is required");
        }
        Set<String> seen = new HashSet<>();
        for (String id : targetIds) {
            if (id == null || id.isBlank()) {
                throw JobException.invalidInput("Target ids must not be blank");
            }
            if (!seen.add(id)) {
                throw JobException.invalidInput("Duplicate target id: " + id);
            }
        }
    }

    private void runSafely(String jobId) {
        try {
            run(jobId);
        } catch (Exception e) {
            log.error("Unhandled error while running job {}: {}", jobId, e.getMessage(), e);
            try {
                store.update(jobId, j -> j.status().isTerminal() ? j : j.aborted("Unhandled error: " + e.getMessage()));
            } catch (Exception nested) {
                log.error("Could not mark job {} as failed; the startup reconciliation will", jobId, nested);
            }
        }
    }

    private void closeQuietly(PipelineRun execution, String jobId) {
        try {
            execution.close();
        } catch (Exception e) {
            log.warn("Cleanup after job {} failed: {}", jobId, e.getMessage());
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void recordMetrics(Job job, Timer.Sample sample) {
        String kind   = job.kind().name().toLowerCase();
        String status = job.status().name().toLowerCase();
        sample.stop(meterRegistry.timer("hostpanel.job.duration", "kind", kind, "status", status));
        for (TargetResult t : job.targets()) {
            meterRegistry.counter("hostpanel.job.targets",
                    "kind", kind, "status", t.status().name().toLowerCase()).increment();
        }
    }
}
