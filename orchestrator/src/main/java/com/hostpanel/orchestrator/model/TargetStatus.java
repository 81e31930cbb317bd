package com.hostpanel.orchestrator.model;

/**
 * Outcome of one target within a Job.
 *
 * PENDING is the only non-final value. Once a target leaves PENDING it never
 * returns to it; SKIPPED targets do not block job completion.
 */
public enum TargetStatus {
    PENDING,
    SUCCESS,
    FAILED,
    SKIPPED
}
