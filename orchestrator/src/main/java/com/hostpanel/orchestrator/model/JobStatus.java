package com.hostpanel.orchestrator.model;

/**
 * Lifecycle of a Job.
 *
 * Transitions:
 *   PENDING → RUNNING → COMPLETED | FAILED
 *   PENDING | RUNNING → CANCELLED  (advisory, see JobService.cancel)
 *
 * COMPLETED, FAILED and CANCELLED are terminal: nothing moves a job out of them.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
