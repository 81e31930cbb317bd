package com.hostpanel.orchestrator.migration;

import com.hostpanel.orchestrator.hypervisor.CredentialCipher;
import com.hostpanel.orchestrator.hypervisor.ImportMetadata;
import com.hostpanel.orchestrator.hypervisor.ProxmoxClient;
import com.hostpanel.orchestrator.model.*;
import com.hostpanel.orchestrator.repository.ImportedVmRepository;
import com.hostpanel.orchestrator.repository.SourceHostRepository;
import com.hostpanel.orchestrator.repository.TargetClusterRepository;
import com.hostpanel.orchestrator.service.JobException;
import com.hostpanel.orchestrator.service.PipelineRun;
import com.hostpanel.orchestrator.service.TargetContext;
import com.hostpanel.orchestrator.service.TargetOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Migration performed by the target cluster itself.
 *
 * Setup checks that the cluster can import from ESXi natively, registers the
 * source host as a transient "esxi" storage named esxi-import-&lt;job id prefix&gt;,
 * and reads the import metadata of every VM it exposes. Each target then
 * becomes a single VM creation whose disks carry import-from=&lt;volid&gt;; the
 * cluster copies the disks inside the creation task. The storage is removed
 * when the job ends.
 *
 * A cluster without native import support fails every target. There is no
 * fallback to the full pipeline.
 */
@Component
public class NativeImportStrategy implements MigrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(NativeImportStrategy.class);

    static final String STORAGE_PREFIX = "esxi-import-";

    private final ProxmoxClient           proxmox;
    private final VmidAllocator           vmids;
    private final CredentialCipher        cipher;
    private final SourceHostRepository    sourceHosts;
    private final TargetClusterRepository clusters;
    private final ImportedVmRepository    importedVms;
    private final Duration                taskTimeout;

    public NativeImportStrategy(ProxmoxClient proxmox,
                                VmidAllocator vmids,
                                CredentialCipher cipher,
                                SourceHostRepository sourceHosts,
                                TargetClusterRepository clusters,
                                ImportedVmRepository importedVms,
                                @Value("${hostpanel.migration.task-timeout-minutes:60}") long taskTimeoutMinutes) {
        this.proxmox     = proxmox;
        this.vmids       = vmids;
        this.cipher      = cipher;
        this.sourceHosts = sourceHosts;
        this.clusters    = clusters;
        this.importedVms = importedVms;
        this.taskTimeout = Duration.ofMinutes(taskTimeoutMinutes);
    }

    @Override
    public ImportStrategy type() {
        return ImportStrategy.NATIVE_IMPORT;
    }

    @Override
    public PipelineRun open(Job job, MigrationParameters params) {
        SourceHost source = sourceHosts.findById(params.sourceHostId())
                .orElseThrow(() -> JobException.notFound("Source host", params.sourceHostId()));
        TargetCluster cluster = clusters.findById(params.clusterId())
                .orElseThrow(() -> JobException.notFound("Cluster", params.clusterId()));

        if (!proxmox.supportsNativeEsxiImport(cluster)) {
            String reason = "Cluster " + cluster.getName() + " does not support native ESXi import"
                    + " (requires Proxmox VE 8.2 or later)";
            log.warn("Job {}: {}", job.id(), reason);
            return target -> {
                throw new JobException(JobException.Kind.TARGET_FAILURE, reason);
            };
        }

        String storage = STORAGE_PREFIX + job.id().substring(0, 8);
        proxmox.addEsxiStorage(cluster, storage, source.getHost(), source.getUsername(),
                cipher.decrypt(source.getPasswordEncrypted()));
        Run run = new Run(job.id(), params, source, cluster, storage);
        try {
            run.loadCatalogue();
        } catch (RuntimeException e) {
            run.close();
            throw e;
        }
        return run;
    }

    // ------------------------------------------------------------------
    // Per-job state
    // ------------------------------------------------------------------

    private class Run implements PipelineRun {

        private final String              jobId;
        private final MigrationParameters params;
        private final SourceHost          source;
        private final TargetCluster       cluster;
        private final String              storage;

        private final Map<String, ImportMetadata> catalogue = new LinkedHashMap<>();

        Run(String jobId, MigrationParameters params, SourceHost source, TargetCluster cluster, String storage) {
            this.jobId   = jobId;
            this.params  = params;
            this.source  = source;
            this.cluster = cluster;
            this.storage = storage;
        }

        /** Read the metadata of every VM the import storage exposes; unreadable ones are skipped. */
        void loadCatalogue() {
            for (String volid : proxmox.listVmxVolumes(cluster, params.node(), storage)) {
                String volume = volid.substring(volid.indexOf(':') + 1);
                try {
                    ImportMetadata metadata = proxmox.importMetadata(cluster, params.node(), storage, volume);
                    catalogue.putIfAbsent(metadata.vmName(), metadata);
                } catch (RuntimeException e) {
                    log.warn("Job {}: no import metadata for {}: {}", jobId, volume, e.getMessage());
                }
            }
            log.info("Job {}: {} importable VMs on {}", jobId, catalogue.size(), source.getHost());
        }

        @Override
        public TargetOutcome processTarget(TargetContext target) {
            target.stage(MigrationStage.DISCOVERING, "Looking up " + target.targetId() + " on import storage");
            ImportMetadata vm = catalogue.get(target.targetId());
            if (vm == null) {
                throw new JobException(JobException.Kind.TARGET_FAILURE,
                        "VM '" + target.targetId() + "' not exposed by " + source.getHost());
            }

            int vmid = vmids.allocate(cluster);
            try {
                target.stage(MigrationStage.CREATING, "Importing as VM " + vmid + " on " + params.node());
                Map<String, String> config = vmConfig(vm, vmid);
                String upid = proxmox.createVm(cluster, params.node(), config);
                proxmox.waitForTask(cluster, params.node(), upid, taskTimeout);
                if (params.startAfterImport()) {
                    proxmox.startVm(cluster, params.node(), vmid);
                }

                CreateArgs args = new CreateArgs(vm);
                importedVms.save(new ImportedVm(cluster.getId(), params.node(), vmid, vm.vmName(),
                        args.sockets() * args.cores(), args.memory(), vm.dataDiskSizeGB(), source.getId(), jobId));

                target.stage(MigrationStage.COMPLETED, "Imported as VM " + vmid);
                return TargetOutcome.success(String.valueOf(vmid),
                        "Imported as VM " + vmid + " on " + cluster.getName() + "/" + params.node());
            } finally {
                vmids.release(cluster, vmid);
            }
        }

        private Map<String, String> vmConfig(ImportMetadata vm, int vmid) {
            CreateArgs args = new CreateArgs(vm);
            Map<String, String> config = new LinkedHashMap<>();
            config.put("vmid",    String.valueOf(vmid));
            config.put("name",    vm.vmName());
            config.put("ostype",  args.text("ostype", "other"));
            config.put("cores",   String.valueOf(args.cores()));
            config.put("sockets", String.valueOf(args.sockets()));
            config.put("memory",  String.valueOf(args.memory()));
            config.put("scsihw",  args.text("scsihw", "virtio-scsi-pci"));
            config.put("bios",    args.text("bios", "seabios"));
            config.put("boot",    "order=scsi0");
            config.put("agent",   "1");

            var net0 = vm.net().path("net0");
            if (net0.isObject()) {
                String mac = net0.path("macaddr").asText("");
                config.put("net0", net0.path("model").asText("virtio") + ",bridge=" + params.bridge()
                        + (mac.isEmpty() ? "" : ",macaddr=" + mac));
            } else {
                config.put("net0", "virtio,bridge=" + params.bridge());
            }

            int index = 0;
            for (String volid : vm.dataDisks().values()) {
                config.put("scsi" + index++, params.storage() + ":0,import-from=" + volid);
            }
            String efi = vm.efiDiskVolid();
            if (efi != null) {
                config.put(ImportMetadata.EFI_DISK,
                        params.storage() + ":0,efitype=4m,pre-enrolled-keys=1,import-from=" + efi);
            }
            return config;
        }

        @Override
        public void close() {
            try {
                proxmox.removeStorage(cluster, storage);
            } catch (RuntimeException e) {
                log.warn("Job {}: could not remove import storage {}: {}", jobId, storage, e.getMessage());
            }
        }
    }

    /** Defaults for the creation arguments the cluster suggests. */
    private record CreateArgs(ImportMetadata vm) {
        int cores()   { return vm.createArgs().path("cores").asInt(1); }
        int sockets() { return vm.createArgs().path("sockets").asInt(1); }
        int memory()  { return vm.createArgs().path("memory").asInt(512); }

        String text(String key, String fallback) {
            String value = vm.createArgs().path(key).asText("");
            return value.isEmpty() ? fallback : value;
        }
    }
}
