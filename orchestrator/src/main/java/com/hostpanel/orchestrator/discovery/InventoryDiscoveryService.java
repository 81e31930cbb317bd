package com.hostpanel.orchestrator.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.hostpanel.orchestrator.hypervisor.HypervisorException;
import com.hostpanel.orchestrator.hypervisor.SourceInventoryClient;
import com.hostpanel.orchestrator.model.DiscoveredVm;
import com.hostpanel.orchestrator.model.SourceHost;
import com.hostpanel.orchestrator.repository.SourceHostRepository;
import com.hostpanel.orchestrator.service.JobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds and stores the VM inventory snapshot of a source host.
 *
 * Steps of {@link #discover}:
 *   1. Retrieve every VM document from the source in one bulk call
 *   2. Normalize each document; documents that fail are logged and skipped
 *   3. In one transaction, delete the host's previous snapshot and insert the new one
 *
 * Steps 1 and 2 run outside any transaction; only step 3 holds a connection.
 *
 * Running discovery twice against an unchanged source yields the same
 * snapshot, and a VM removed at the source disappears on the next run.
 */
@Service
public class InventoryDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(InventoryDiscoveryService.class);

    private final SourceHostRepository   hostRepo;
    private final InventorySnapshotStore snapshots;
    private final SourceInventoryClient  inventory;
    private final VmDescriptorParser     parser;

    public InventoryDiscoveryService(SourceHostRepository hostRepo,
                                     InventorySnapshotStore snapshots,
                                     SourceInventoryClient inventory,
                                     VmDescriptorParser parser) {
        this.hostRepo  = hostRepo;
        this.snapshots = snapshots;
        this.inventory = inventory;
        this.parser    = parser;
    }

    /**
     * Replace the stored snapshot of {@code sourceHostId} with a fresh one.
     *
     * @throws JobException       NOT_FOUND for an unknown host, SOURCE_UNREACHABLE when retrieval fails
     * @throws DiscoveryException when the new snapshot cannot be stored
     */
    public List<DiscoveredVm> discover(Long sourceHostId) {
        SourceHost host = hostRepo.findById(sourceHostId)
                .orElseThrow(() -> JobException.notFound("Source host", sourceHostId));

        List<JsonNode> documents;
        try {
            documents = inventory.retrieveVirtualMachines(host);
        } catch (HypervisorException e) {
            log.error("Discovery of {} failed: {}", host.getHost(), e.getMessage());
            throw new JobException(JobException.Kind.SOURCE_UNREACHABLE,
                    "Cannot retrieve inventory from " + host.getHost() + ": " + e.getMessage(), e);
        }

        List<DiscoveredVm> snapshot = new ArrayList<>();
        for (JsonNode document : documents) {
            try {
                DiscoveredVm vm = parser.parse(document);
                vm.assignTo(sourceHostId, snapshot.size());
                snapshot.add(vm);
            } catch (RuntimeException e) {
                log.warn("Skipping VM '{}' on {}: {}",
                        document.path("name").asText("?"), host.getHost(), e.getMessage());
            }
        }

        try {
            int removed = snapshots.replace(sourceHostId, snapshot);
            log.info("Discovered {} VMs on {} (replaced {})", snapshot.size(), host.getHost(), removed);
            return snapshot;
        } catch (RuntimeException e) {
            throw new DiscoveryException("Failed to store inventory snapshot for source host " + sourceHostId, e);
        }
    }

    /** The stored snapshot, in source order; empty when discovery never ran. */
    public List<DiscoveredVm> getSnapshot(Long sourceHostId) {
        return snapshots.load(sourceHostId);
    }
}
