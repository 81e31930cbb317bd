package com.hostpanel.orchestrator.repository;

import com.hostpanel.orchestrator.model.ImportedVm;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Local registry of VMs created on target clusters.
 */
public interface ImportedVmRepository extends JpaRepository<ImportedVm, Long> {

    /** Collision check used by VMID allocation. */
    boolean existsByClusterIdAndVmid(Long clusterId, int vmid);
}
