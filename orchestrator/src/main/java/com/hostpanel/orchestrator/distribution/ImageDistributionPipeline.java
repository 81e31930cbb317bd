package com.hostpanel.orchestrator.distribution;

import com.hostpanel.orchestrator.model.Job;
import com.hostpanel.orchestrator.model.JobKind;
import com.hostpanel.orchestrator.model.TargetCluster;
import com.hostpanel.orchestrator.repository.TargetClusterRepository;
import com.hostpanel.orchestrator.service.JobException;
import com.hostpanel.orchestrator.service.JobPipeline;
import com.hostpanel.orchestrator.service.PipelineRun;
import com.hostpanel.orchestrator.service.TargetContext;
import com.hostpanel.orchestrator.service.TargetOutcome;
import com.hostpanel.orchestrator.transfer.DiskConversionService;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * DISTRIBUTION jobs: copy an installation image from one cluster to others.
 *
 * Steps:
 *   1. setup downloads the image from the source cluster once
 *   2. each target cluster gets an upload of that local copy
 *   3. the local copy is deleted when the job ends
 *
 * Targets are cluster ids. The source cluster itself, if listed, is SKIPPED.
 */
@Component
public class ImageDistributionPipeline implements JobPipeline {

    private static final Logger log = LoggerFactory.getLogger(ImageDistributionPipeline.class);

    enum Stage { UPLOADING }

    private final TargetClusterRepository clusters;
    private final DiskConversionService   transfer;
    private final Path                    scratchDir;

    public ImageDistributionPipeline(TargetClusterRepository clusters,
                                     DiskConversionService transfer,
                                     @Value("${hostpanel.transfer.scratch-dir:/var/tmp/hostpanel}") String scratchDir) {
        this.clusters   = clusters;
        this.transfer   = transfer;
        this.scratchDir = Path.of(scratchDir);
    }

    @Override
    public JobKind kind() {
        return JobKind.DISTRIBUTION;
    }

    @Override
    public Map<String, Object> validate(List<String> targetIds, Map<String, Object> parameters) {
        DistributionParameters params = DistributionParameters.from(parameters);
        if (!clusters.existsById(params.sourceClusterId())) {
            throw JobException.invalidInput("Unknown source cluster " + params.sourceClusterId());
        }
        for (String target : targetIds) {
            Long id = parseClusterId(target);
            if (!clusters.existsById(id)) {
                throw JobException.invalidInput("Unknown target cluster " + target);
            }
        }
        return params.toMap();
    }

    /** The single download from the source cluster. */
    @Override
    public int setupWeight() {
        return 10;
    }

    @Override
    public PipelineRun open(Job job) {
        DistributionParameters params = DistributionParameters.from(job.parameters());
        TargetCluster source = clusters.findById(params.sourceClusterId())
                .orElseThrow(() -> JobException.notFound("Cluster", params.sourceClusterId()));
        Path workDir = scratchDir.resolve(job.id());
        log.info("Job {}: fetching {} from {}", job.id(), params.sourcePath(), source.getName());
        Run run = new Run(job.id(), params, workDir);
        try {
            run.image = transfer.download(source, params.sourcePath(), workDir);
        } catch (RuntimeException e) {
            run.close();
            throw e;
        }
        return run;
    }

    private class Run implements PipelineRun {

        private final String                 jobId;
        private final DistributionParameters params;
        private final Path                   workDir;
        private Path                         image;

        Run(String jobId, DistributionParameters params, Path workDir) {
            this.jobId   = jobId;
            this.params  = params;
            this.workDir = workDir;
        }

        @Override
        public TargetOutcome processTarget(TargetContext target) {
            Long clusterId = parseClusterId(target.targetId());
            if (clusterId.equals(params.sourceClusterId())) {
                return TargetOutcome.skipped("Source cluster already has " + params.filename());
            }
            TargetCluster cluster = clusters.findById(clusterId)
                    .orElseThrow(() -> new JobException(JobException.Kind.TARGET_FAILURE,
                            "Cluster " + clusterId + " no longer exists"));
            target.stage(Stage.UPLOADING, "Uploading " + params.filename() + " to " + cluster.getName());
            String remotePath = transfer.upload(image, cluster, params.targetDir());
            return TargetOutcome.success(remotePath, "Copied to " + cluster.getName());
        }

        @Override
        public void close() {
            try {
                FileUtils.deleteDirectory(workDir.toFile());
            } catch (IOException e) {
                log.warn("Job {}: could not remove {}: {}", jobId, workDir, e.getMessage());
            }
        }
    }

    private static Long parseClusterId(String target) {
        try {
            return Long.valueOf(target.trim());
        } catch (NumberFormatException e) {
            throw JobException.invalidInput("Target '" + target + "' is not a cluster id");
        }
    }
}
