package com.hostpanel.orchestrator.migration;

import com.hostpanel.orchestrator.hypervisor.ProxmoxClient;
import com.hostpanel.orchestrator.model.Job;
import com.hostpanel.orchestrator.model.JobKind;
import com.hostpanel.orchestrator.model.TargetCluster;
import com.hostpanel.orchestrator.repository.SourceHostRepository;
import com.hostpanel.orchestrator.repository.TargetClusterRepository;
import com.hostpanel.orchestrator.service.JobException;
import com.hostpanel.orchestrator.service.JobPipeline;
import com.hostpanel.orchestrator.service.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * MIGRATION jobs: move VMs, named by their source inventory name, from an
 * ESXi host to a Proxmox cluster.
 *
 * The import strategy is fixed at submission. An explicit choice is kept as
 * is; without one the target cluster is asked for its version and
 * NATIVE_IMPORT is chosen when it is supported.
 */
@Component
public class MigrationPipeline implements JobPipeline {

    private static final Logger log = LoggerFactory.getLogger(MigrationPipeline.class);

    private final Map<ImportStrategy, MigrationStrategy> strategies = new EnumMap<>(ImportStrategy.class);
    private final SourceHostRepository    sourceHosts;
    private final TargetClusterRepository clusters;
    private final ProxmoxClient           proxmox;

    public MigrationPipeline(List<MigrationStrategy> allStrategies,
                             SourceHostRepository sourceHosts,
                             TargetClusterRepository clusters,
                             ProxmoxClient proxmox) {
        for (MigrationStrategy strategy : allStrategies) {
            strategies.put(strategy.type(), strategy);
        }
        this.sourceHosts = sourceHosts;
        this.clusters    = clusters;
        this.proxmox     = proxmox;
    }

    @Override
    public JobKind kind() {
        return JobKind.MIGRATION;
    }

    @Override
    public Map<String, Object> validate(List<String> targetIds, Map<String, Object> parameters) {
        MigrationParameters params = MigrationParameters.from(parameters);
        if (!sourceHosts.existsById(params.sourceHostId())) {
            throw JobException.invalidInput("Unknown source host " + params.sourceHostId());
        }
        Long clusterId = params.clusterId();
        TargetCluster cluster = clusters.findById(clusterId)
                .orElseThrow(() -> JobException.invalidInput("Unknown cluster " + clusterId));
        MigrationParameters resolved = params.strategy() == null
                ? params.withStrategy(detectStrategy(cluster))
                : params;
        return resolved.toMap();
    }

    /** Downloading the inventory or registering the import storage. */
    @Override
    public int setupWeight() {
        return 10;
    }

    @Override
    public PipelineRun open(Job job) throws Exception {
        MigrationParameters params = MigrationParameters.from(job.parameters());
        ImportStrategy type = params.strategy() != null ? params.strategy() : ImportStrategy.FULL_PIPELINE;
        MigrationStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalStateException("No migration strategy registered for " + type);
        }
        log.info("Job {}: migrating {} VMs with {}", job.id(), job.targets().size(), type);
        return strategy.open(job, params);
    }

    private ImportStrategy detectStrategy(TargetCluster cluster) {
        try {
            return proxmox.supportsNativeEsxiImport(cluster)
                    ? ImportStrategy.NATIVE_IMPORT
                    : ImportStrategy.FULL_PIPELINE;
        } catch (RuntimeException e) {
            log.warn("Cannot check cluster {} for native import, using full pipeline: {}",
                    cluster.getName(), e.getMessage());
            return ImportStrategy.FULL_PIPELINE;
        }
    }
}
