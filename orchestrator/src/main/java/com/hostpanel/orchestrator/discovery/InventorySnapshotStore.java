package com.hostpanel.orchestrator.discovery;

import com.hostpanel.orchestrator.model.DiscoveredVm;
import com.hostpanel.orchestrator.repository.DiscoveredVmRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Transactional access to the discovered_vms table.
 *
 * Kept apart from {@link InventoryDiscoveryService} so the remote inventory
 * call happens before any transaction is opened.
 */
@Component
public class InventorySnapshotStore {

    private final DiscoveredVmRepository vmRepo;

    public InventorySnapshotStore(DiscoveredVmRepository vmRepo) {
        this.vmRepo = vmRepo;
    }

    /**
     * Delete every row of the host and insert {@code snapshot}, in one transaction.
     *
     * @return number of rows removed
     */
    @Transactional
    public int replace(Long sourceHostId, List<DiscoveredVm> snapshot) {
        int removed = vmRepo.deleteBySourceHostId(sourceHostId);
        vmRepo.saveAllAndFlush(snapshot);
        return removed;
    }

    @Transactional(readOnly = true)
    public List<DiscoveredVm> load(Long sourceHostId) {
        return vmRepo.findBySourceHostIdOrderByPositionAsc(sourceHostId);
    }
}
