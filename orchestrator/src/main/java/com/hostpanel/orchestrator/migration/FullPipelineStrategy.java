package com.hostpanel.orchestrator.migration;

import com.hostpanel.orchestrator.discovery.InventoryDiscoveryService;
import com.hostpanel.orchestrator.hypervisor.ProxmoxClient;
import com.hostpanel.orchestrator.model.*;
import com.hostpanel.orchestrator.repository.ImportedVmRepository;
import com.hostpanel.orchestrator.repository.SourceHostRepository;
import com.hostpanel.orchestrator.repository.TargetClusterRepository;
import com.hostpanel.orchestrator.service.JobException;
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
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Migration through this machine.
 *
 * Setup loads the source host's inventory snapshot, running discovery when
 * none is stored yet. Then per VM:
 *   1. allocate a VMID on the target cluster
 *   2. download and convert every disk to vm-&lt;vmid&gt;-disk-&lt;i&gt;.qcow2
 *   3. upload the images into &lt;imageRoot&gt;/&lt;vmid&gt;/ on the target node
 *   4. create the VM referencing the uploaded images and wait for the task
 *   5. start it if requested, record it, discard the local images
 *
 * Local images of a VM that failed stay in the job's scratch directory until
 * the job ends.
 */
@Component
public class FullPipelineStrategy implements MigrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(FullPipelineStrategy.class);

    private final InventoryDiscoveryService discovery;
    private final DiskConversionService     transfer;
    private final ProxmoxClient             proxmox;
    private final VmidAllocator             vmids;
    private final SourceHostRepository      sourceHosts;
    private final TargetClusterRepository   clusters;
    private final ImportedVmRepository      importedVms;
    private final Path                      scratchDir;
    private final String                    imageRoot;
    private final Duration                  taskTimeout;

    public FullPipelineStrategy(InventoryDiscoveryService discovery,
                                DiskConversionService transfer,
                                ProxmoxClient proxmox,
                                VmidAllocator vmids,
                                SourceHostRepository sourceHosts,
                                TargetClusterRepository clusters,
                                ImportedVmRepository importedVms,
                                @Value("${hostpanel.transfer.scratch-dir:/var/tmp/hostpanel}") String scratchDir,
                                @Value("${hostpanel.migration.image-root:/var/lib/vz/images}") String imageRoot,
                                @Value("${hostpanel.migration.task-timeout-minutes:60}") long taskTimeoutMinutes) {
        this.discovery   = discovery;
        this.transfer    = transfer;
        this.proxmox     = proxmox;
        this.vmids       = vmids;
        this.sourceHosts = sourceHosts;
        this.clusters    = clusters;
        this.importedVms = importedVms;
        this.scratchDir  = Path.of(scratchDir);
        this.imageRoot   = imageRoot;
        this.taskTimeout = Duration.ofMinutes(taskTimeoutMinutes);
    }

    @Override
    public ImportStrategy type() {
        return ImportStrategy.FULL_PIPELINE;
    }

    @Override
    public PipelineRun open(Job job, MigrationParameters params) {
        SourceHost source = sourceHosts.findById(params.sourceHostId())
                .orElseThrow(() -> JobException.notFound("Source host", params.sourceHostId()));
        TargetCluster cluster = clusters.findById(params.clusterId())
                .orElseThrow(() -> JobException.notFound("Cluster", params.clusterId()));

        List<DiscoveredVm> snapshot = discovery.getSnapshot(source.getId());
        if (snapshot.isEmpty()) {
            log.info("Job {}: no inventory stored for {}, discovering", job.id(), source.getHost());
            snapshot = discovery.discover(source.getId());
        }
        Map<String, DiscoveredVm> byName = new LinkedHashMap<>();
        for (DiscoveredVm vm : snapshot) {
            byName.putIfAbsent(vm.getName(), vm);
        }
        return new Run(job.id(), params, source, cluster, byName, scratchDir.resolve(job.id()));
    }

    // ------------------------------------------------------------------
    // Per-job state
    // ------------------------------------------------------------------

    private class Run implements PipelineRun {

        private final String                    jobId;
        private final MigrationParameters       params;
        private final SourceHost                source;
        private final TargetCluster             cluster;
        private final Map<String, DiscoveredVm> inventory;
        private final Path                      workDir;

        Run(String jobId, MigrationParameters params, SourceHost source, TargetCluster cluster,
            Map<String, DiscoveredVm> inventory, Path workDir) {
            this.jobId     = jobId;
            this.params    = params;
            this.source    = source;
            this.cluster   = cluster;
            this.inventory = inventory;
            this.workDir   = workDir;
        }

        @Override
        public TargetOutcome processTarget(TargetContext target) {
            target.stage(MigrationStage.DISCOVERING, "Looking up " + target.targetId() + " in inventory");
            DiscoveredVm vm = inventory.get(target.targetId());
            if (vm == null) {
                throw new JobException(JobException.Kind.TARGET_FAILURE,
                        "VM '" + target.targetId() + "' not found in the inventory of " + source.getHost());
            }
            if (vm.getDisks().isEmpty()) {
                throw new JobException(JobException.Kind.TARGET_FAILURE, "VM '" + vm.getName() + "' has no disks");
            }

            int vmid = vmids.allocate(cluster);
            try {
                List<DiskInfo> disks = vm.getDisks();
                List<Path> images = new ArrayList<>();
                for (int i = 0; i < disks.size(); i++) {
                    final int disk = i;
                    target.stage(MigrationStage.DOWNLOADING,
                            "Downloading disk " + (disk + 1) + " of " + disks.size());
                    images.add(transfer.convert(source, disks.get(disk).sourcePath(), workDir,
                            "vm-" + vmid + "-disk-" + disk,
                            () -> target.stage(MigrationStage.CONVERTING,
                                    "Converting disk " + (disk + 1) + " of " + disks.size())));
                }

                String remoteDir = imageRoot + "/" + vmid;
                for (int i = 0; i < images.size(); i++) {
                    target.stage(MigrationStage.UPLOADING, "Uploading disk " + (i + 1) + " of " + images.size());
                    transfer.upload(images.get(i), cluster, remoteDir);
                }

                target.stage(MigrationStage.CREATING, "Creating VM " + vmid + " on " + params.node());
                String upid = proxmox.createVm(cluster, params.node(), vmConfig(vm, vmid, images));
                proxmox.waitForTask(cluster, params.node(), upid, taskTimeout);
                if (params.startAfterImport()) {
                    proxmox.startVm(cluster, params.node(), vmid);
                }

                importedVms.save(new ImportedVm(cluster.getId(), params.node(), vmid, vm.getName(),
                        vm.getCpuCores(), vm.getMemoryMB(), vm.getDiskGB(), source.getId(), jobId));
                images.forEach(transfer::discard);

                target.stage(MigrationStage.COMPLETED, "Imported as VM " + vmid);
                return TargetOutcome.success(String.valueOf(vmid),
                        "Imported as VM " + vmid + " on " + cluster.getName() + "/" + params.node());
            } finally {
                vmids.release(cluster, vmid);
            }
        }

        private Map<String, String> vmConfig(DiscoveredVm vm, int vmid, List<Path> images) {
            Map<String, String> config = new LinkedHashMap<>();
            config.put("vmid",   String.valueOf(vmid));
            config.put("name",   vm.getName());
            config.put("cores",  String.valueOf(Math.max(1, vm.getCpuCores())));
            config.put("memory", String.valueOf(Math.max(512, vm.getMemoryMB())));
            config.put("ostype", GuestOsMapper.toOsType(vm.getGuestOS()));
            config.put("scsihw", "virtio-scsi-pci");
            for (int i = 0; i < images.size(); i++) {
                config.put("scsi" + i, params.storage() + ":" + vmid + "/" + images.get(i).getFileName());
            }
            config.put("boot", "order=scsi0");
            List<NetworkAdapter> nics = vm.getNetworkAdapters();
            if (nics.isEmpty()) {
                config.put("net0", "virtio,bridge=" + params.bridge());
            }
            for (int i = 0; i < nics.size(); i++) {
                String mac = nics.get(i).macAddress();
                config.put("net" + i, "virtio,bridge=" + params.bridge() + (mac != null ? ",macaddr=" + mac : ""));
            }
            return config;
        }

        @Override
        public void close() {
            try {
                FileUtils.deleteDirectory(workDir.toFile());
            } catch (IOException e) {
                log.warn("Job {}: could not remove scratch directory {}: {}", jobId, workDir, e.getMessage());
            }
        }
    }
}
