package com.hostpanel.orchestrator.model;

import com.hostpanel.orchestrator.model.json.JsonMapConverter;
import com.hostpanel.orchestrator.model.json.TargetResultListConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable record of a Job: the source of truth that the in-memory cache is
 * rebuilt from after a restart or eviction.
 *
 * Targets and parameters are stored as JSON text so the schema does not
 * change when a pipeline adds fields.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class JobRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status;

    @Column(nullable = false)
    private int progress;

    @Convert(converter = TargetResultListConverter.class)
    @Column(name = "targets", columnDefinition = "TEXT", nullable = false)
    private List<TargetResult> targets = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "parameters", columnDefinition = "TEXT")
    private Map<String, Object> parameters = new LinkedHashMap<>();

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    @PrePersist
    void touch() {
        this.updatedAt = Instant.now();
    }

    protected JobRecord() {}   // required by JPA

    // ------------------------------------------------------------------
    // Snapshot conversion
    // ------------------------------------------------------------------

    public static JobRecord from(Job job) {
        JobRecord r = new JobRecord();
        r.id = job.id();
        r.copyFrom(job);
        r.createdAt = job.createdAt();
        return r;
    }

    /** Overwrite every mutable column with the snapshot's values. */
    public void copyFrom(Job job) {
        this.kind        = job.kind();
        this.status      = job.status();
        this.progress    = job.progress();
        this.targets     = new ArrayList<>(job.targets());
        this.parameters  = new LinkedHashMap<>(job.parameters());
        this.error       = job.error();
        this.startedAt   = job.startedAt();
        this.completedAt = job.completedAt();
    }

    public Job toJob() {
        return new Job(id, kind, status, progress, targets, parameters,
                error, createdAt, startedAt, completedAt);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String    getId()          { return id; }
    public JobKind   getKind()        { return kind; }
    public JobStatus getStatus()      { return status; }
    public int       getProgress()    { return progress; }
    public String    getError()       { return error; }
    public Instant   getCreatedAt()   { return createdAt; }
}
