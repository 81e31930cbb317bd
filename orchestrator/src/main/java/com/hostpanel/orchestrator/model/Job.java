package com.hostpanel.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of one long-running operation.
 *
 * Pollers only ever see instances of this record, so a reader can never
 * observe a job halfway through a mutation. {@link JobRecord} is the
 * durable counterpart; {@link com.hostpanel.orchestrator.service.JobStore}
 * converts between the two.
 *
 * Invariants maintained by the with* methods:
 *   - progress never decreases
 *   - progress == 100 exactly when the status is terminal
 *   - a terminal status is never replaced
 */
public record Job(
        String              id,
        JobKind             kind,
        JobStatus           status,
        int                 progress,
        List<TargetResult>  targets,
        Map<String, Object> parameters,
        String              error,
        Instant             createdAt,
        Instant             startedAt,
        Instant             completedAt
) {

    public Job {
        targets    = List.copyOf(targets);
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /** A fresh PENDING job with one pending result per target id. */
    public static Job pending(JobKind kind, List<String> targetIds, Map<String, Object> parameters) {
        List<TargetResult> results = targetIds.stream().map(TargetResult::pending).toList();
        return new Job(UUID.randomUUID().toString(), kind, JobStatus.PENDING, 0,
                results, parameters, null, Instant.now(), null, null);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public Job started() {
        requireNotTerminal("start");
        return new Job(id, kind, JobStatus.RUNNING, progress, targets, parameters,
                error, createdAt, Instant.now(), completedAt);
    }

    /**
     * Raise progress to {@code value}. Values below the current progress are
     * ignored; non-terminal jobs are capped at 99 so that 100 keeps meaning "finished".
     */
    public Job withProgress(int value) {
        if (status.isTerminal()) {
            return this;
        }
        int next = Math.max(progress, Math.min(99, value));
        return new Job(id, kind, status, next, targets, parameters,
                error, createdAt, startedAt, completedAt);
    }

    /** Replace the result at {@code index}; allowed even after cancellation so late outcomes are kept. */
    public Job withTarget(int index, TargetResult result) {
        List<TargetResult> copy = new ArrayList<>(targets);
        copy.set(index, result);
        return new Job(id, kind, status, progress, copy, parameters,
                error, createdAt, startedAt, completedAt);
    }

    /** Terminal transition to COMPLETED or FAILED derived from the target outcomes. */
    public Job finished() {
        requireNotTerminal("finish");
        return terminal(aggregateStatus(), error);
    }

    /** Job-level abort: targets are left as they are (normally all PENDING). */
    public Job aborted(String reason) {
        requireNotTerminal("abort");
        return terminal(JobStatus.FAILED, reason);
    }

    public Job cancelled(String reason) {
        requireNotTerminal("cancel");
        return terminal(JobStatus.CANCELLED, reason);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * COMPLETED iff at least one target exists and every target is SUCCESS or
     * SKIPPED; FAILED otherwise (any failed or still-pending target).
     */
    public JobStatus aggregateStatus() {
        if (targets.isEmpty()) {
            return JobStatus.FAILED;
        }
        boolean allDone = targets.stream().allMatch(t ->
                t.status() == TargetStatus.SUCCESS || t.status() == TargetStatus.SKIPPED);
        return allDone ? JobStatus.COMPLETED : JobStatus.FAILED;
    }

    public long countTargets(TargetStatus wanted) {
        return targets.stream().filter(t -> t.status() == wanted).count();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job terminal(JobStatus terminalStatus, String reason) {
        return new Job(id, kind, terminalStatus, 100, targets, parameters,
                reason, createdAt, startedAt, Instant.now());
    }

    private void requireNotTerminal(String action) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot " + action + " job " + id + " in terminal state " + status);
        }
    }
}
