package com.hostpanel.orchestrator.repository;

import com.hostpanel.orchestrator.model.DiscoveredVm;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Snapshot storage for discovered VMs, scoped by source host.
 */
public interface DiscoveredVmRepository extends JpaRepository<DiscoveredVm, Long> {

    /** The current snapshot, in the order the source listed the VMs. */
    List<DiscoveredVm> findBySourceHostIdOrderByPositionAsc(Long sourceHostId);

    /** Bulk delete; must run inside the same transaction as the re-insert. */
    @Modifying
    @Query("DELETE FROM DiscoveredVm v WHERE v.sourceHostId = :sourceHostId")
    int deleteBySourceHostId(@Param("sourceHostId") Long sourceHostId);
}
