package com.hostpanel.orchestrator.api;

import com.hostpanel.orchestrator.api.dto.JobResponse;
import com.hostpanel.orchestrator.api.dto.SubmitDistributionRequest;
import com.hostpanel.orchestrator.api.dto.SubmitJobResponse;
import com.hostpanel.orchestrator.api.dto.SubmitMigrationRequest;
import com.hostpanel.orchestrator.model.Job;
import com.hostpanel.orchestrator.model.JobKind;
import com.hostpanel.orchestrator.model.JobStatus;
import com.hostpanel.orchestrator.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the job lifecycle.
 *
 * POST /jobs/migrations     submit a VM migration job
 * POST /jobs/distributions  submit an image distribution job
 * GET  /jobs                list jobs, newest first, optionally by kind and status
 * GET  /jobs/{id}           poll a job
 * POST /jobs/{id}/cancel    request cancellation
 *
 * Errors are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Submit a migration. Returns 202 as soon as the job is recorded.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs/migrations \
     *     -H "Content-Type: application/json" \
     *     -d '{"sourceHostId":1,"clusterId":2,"node":"pve1","storage":"local",
     *          "bridge":"vmbr0","vms":["web01","db01"]}'
     */
    @PostMapping("/migrations")
    public ResponseEntity<SubmitJobResponse> submitMigration(@RequestBody SubmitMigrationRequest req) {
        Job job = jobService.submit(JobKind.MIGRATION, req.vms(), req.parameters());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitJobResponse.from(job));
    }

    @PostMapping("/distributions")
    public ResponseEntity<SubmitJobResponse> submitDistribution(@RequestBody SubmitDistributionRequest req) {
        Job job = jobService.submit(JobKind.DISTRIBUTION, req.targetIds(), req.parameters());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitJobResponse.from(job));
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) JobKind kind,
                                  @RequestParam(required = false) JobStatus status) {
        return jobService.list(kind, status).stream()
                .map(JobResponse::from)
                .toList();
    }

    /** Returns 404 if the job is unknown. */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable String id) {
        return JobResponse.from(jobService.getStatus(id));
    }

    /**
     * Cancellation takes effect at the next target boundary.
     * 400 if the job already finished, 404 if it is unknown.
     */
    @PostMapping("/{id}/cancel")
    public JobResponse cancel(@PathVariable String id) {
        return JobResponse.from(jobService.cancel(id));
    }
}
