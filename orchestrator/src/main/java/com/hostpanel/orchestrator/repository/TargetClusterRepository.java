package com.hostpanel.orchestrator.repository;

import com.hostpanel.orchestrator.model.TargetCluster;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TargetClusterRepository extends JpaRepository<TargetCluster, Long> {
}
