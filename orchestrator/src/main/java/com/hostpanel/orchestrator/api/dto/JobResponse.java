package com.hostpanel.orchestrator.api.dto;

import com.hostpanel.orchestrator.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body for GET /jobs/{id}, GET /jobs and POST /jobs/{id}/cancel.
 * progress is 0–100 and reaches 100 only once the job is terminal.
 */
public record JobResponse(
        String                     id,
        String                     kind,
        String                     status,
        int                        progress,
        List<TargetResultResponse> targets,
        Map<String, Object>        parameters,
        String                     error,
        Instant                    createdAt,
        Instant                    startedAt,
        Instant                    completedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.kind().name(),
                job.status().name(),
                job.progress(),
                job.targets().stream().map(TargetResultResponse::from).toList(),
                job.parameters(),
                job.error(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt()
        );
    }
}
