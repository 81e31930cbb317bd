package com.hostpanel.orchestrator.repository;

import com.hostpanel.orchestrator.model.SourceHost;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SourceHostRepository extends JpaRepository<SourceHost, Long> {
}
