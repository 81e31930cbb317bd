package com.hostpanel.orchestrator.repository;

import com.hostpanel.orchestrator.model.JobKind;
import com.hostpanel.orchestrator.model.JobRecord;
import com.hostpanel.orchestrator.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

/**
 * CRUD + query operations for the jobs table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface JobRecordRepository extends JpaRepository<JobRecord, String> {

    /** Jobs left unfinished by a previous process (used for restart reconciliation). */
    List<JobRecord> findByStatusIn(Collection<JobStatus> statuses);

    List<JobRecord> findAllByOrderByCreatedAtDesc();

    List<JobRecord> findByKindOrderByCreatedAtDesc(JobKind kind);

    List<JobRecord> findByStatusOrderByCreatedAtDesc(JobStatus status);

    List<JobRecord> findByKindAndStatusOrderByCreatedAtDesc(JobKind kind, JobStatus status);
}
