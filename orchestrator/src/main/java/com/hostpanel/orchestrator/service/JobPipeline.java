package com.hostpanel.orchestrator.service;

import com.hostpanel.orchestrator.model.Job;
import com.hostpanel.orchestrator.model.JobKind;

import java.util.List;
import java.util.Map;

/**
 * Stage logic for one job kind.
 *
 * The orchestrator owns status, progress, persistence and cancellation; a
 * pipeline only knows how to set up a run and how to process one target.
 * Every {@code JobPipeline} bean is picked up by {@link JobService} at startup.
 */
public interface JobPipeline {

    JobKind kind();

    /**
     * Check a submission before any Job exists.
     *
     * @return the parameters to persist with the job (may add resolved defaults)
     * @throws JobException of kind INVALID_INPUT when the submission is malformed
     */
    Map<String, Object> validate(List<String> targetIds, Map<String, Object> parameters);

    /**
     * Share of the progress bar charged to {@link #open} (0 when setup is
     * negligible). The remaining weight is split evenly across targets.
     */
    default int setupWeight() {
        return 0;
    }

    /**
     * Job-level setup shared by all targets (connect to the source, download
     * an image once, register a transient endpoint…). Any exception here
     * aborts the whole job with every target left PENDING.
     */
    PipelineRun open(Job job) throws Exception;
}
