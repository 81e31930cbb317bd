package com.hostpanel.orchestrator.api.dto;

import com.hostpanel.orchestrator.model.Job;

/**
 * Response body for job submissions: enough to start polling GET /jobs/{id}.
 */
public record SubmitJobResponse(String jobId, String initialStatus) {

    public static SubmitJobResponse from(Job job) {
        return new SubmitJobResponse(job.id(), job.status().name());
    }
}
