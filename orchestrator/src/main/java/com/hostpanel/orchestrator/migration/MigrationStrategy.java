package com.hostpanel.orchestrator.migration;

import com.hostpanel.orchestrator.model.Job;
import com.hostpanel.orchestrator.service.PipelineRun;

/**
 * One way of moving VMs to a target cluster.
 */
public interface MigrationStrategy {

    ImportStrategy type();

    /**
     * Job-level preparation; the returned run imports one VM per target.
     * Throwing aborts the job with every target left PENDING.
     */
    PipelineRun open(Job job, MigrationParameters params) throws Exception;
}
