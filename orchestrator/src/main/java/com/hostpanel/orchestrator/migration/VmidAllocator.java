package com.hostpanel.orchestrator.migration;

import com.hostpanel.orchestrator.hypervisor.ProxmoxClient;
import com.hostpanel.orchestrator.model.TargetCluster;
import com.hostpanel.orchestrator.repository.ImportedVmRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks VMIDs for new VMs on a target cluster.
 *
 * Starts from the cluster's own suggestion and skips ids the local registry
 * already holds for that cluster. Ids handed out by this process stay
 * reserved until released, so two jobs importing into the same cluster
 * concurrently never get the same id before either VM exists.
 */
@Component
public class VmidAllocator {

    private static final Logger log = LoggerFactory.getLogger(VmidAllocator.class);

    private final ProxmoxClient        proxmox;
    private final ImportedVmRepository importedVms;

    private final Map<Long, Set<Integer>> handedOut = new ConcurrentHashMap<>();

    public VmidAllocator(ProxmoxClient proxmox, ImportedVmRepository importedVms) {
        this.proxmox     = proxmox;
        this.importedVms = importedVms;
    }

    /**
     * Reserve a VMID on {@code cluster}. The reservation lasts until
     * {@link #release}; callers release once the VM is in the registry or
     * its import has failed.
     */
    public int allocate(TargetCluster cluster) {
        int vmid = proxmox.nextVmid(cluster);
        Set<Integer> issued = handedOut.computeIfAbsent(cluster.getId(), k -> new HashSet<>());
        synchronized (issued) {
            while (issued.contains(vmid) || importedVms.existsByClusterIdAndVmid(cluster.getId(), vmid)) {
                vmid++;
            }
            issued.add(vmid);
        }
        log.debug("Allocated VMID {} on cluster {}", vmid, cluster.getName());
        return vmid;
    }

    public void release(TargetCluster cluster, int vmid) {
        Set<Integer> issued = handedOut.get(cluster.getId());
        if (issued != null) {
            synchronized (issued) {
                issued.remove(vmid);
            }
        }
    }

    int reservedCount(TargetCluster cluster) {
        Set<Integer> issued = handedOut.getOrDefault(cluster.getId(), Set.of());
        synchronized (issued) {
            return issued.size();
        }
    }
}
