package com.hostpanel.orchestrator.model;

/**
 * Tags which pipeline produced (and executes) a Job.
 *
 * Every kind has exactly one {@link com.hostpanel.orchestrator.service.JobPipeline}
 * bean registered for it.
 */
public enum JobKind {
    MIGRATION,
    DISTRIBUTION
}
