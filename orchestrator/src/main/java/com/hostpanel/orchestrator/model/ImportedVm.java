package com.hostpanel.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * A VM this system created on a target cluster.
 *
 * Doubles as the local resource registry consulted during VMID allocation,
 * so (cluster_id, vmid) is unique.
 *
 * DB table: imported_vms  (created by Flyway V3 migration)
 */
@Entity
@Table(name = "imported_vms",
       uniqueConstraints = @UniqueConstraint(columnNames = {"cluster_id", "vmid"}))
public class ImportedVm {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cluster_id", nullable = false)
    private Long clusterId;

    @Column(nullable = false)
    private String node;

    @Column(nullable = false)
    private int vmid;

    @Column(nullable = false)
    private String name;

    @Column(name = "cpu_cores", nullable = false)
    private int cpuCores;

    @Column(name = "memory_mb", nullable = false)
    private long memoryMB;

    @Column(name = "storage_gb", nullable = false)
    private double storageGB;

    @Column(name = "source_host_id")
    private Long sourceHostId;

    @Column(name = "job_id", length = 36)
    private String jobId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ImportedVm() {}   // required by JPA

    public ImportedVm(Long clusterId, String node, int vmid, String name,
                      int cpuCores, long memoryMB, double storageGB,
                      Long sourceHostId, String jobId) {
        this.clusterId    = clusterId;
        this.node         = node;
        this.vmid         = vmid;
        this.name         = name;
        this.cpuCores     = cpuCores;
        this.memoryMB     = memoryMB;
        this.storageGB    = storageGB;
        this.sourceHostId = sourceHostId;
        this.jobId        = jobId;
    }

    public Long    getId()           { return id; }
    public Long    getClusterId()    { return clusterId; }
    public String  getNode()         { return node; }
    public int     getVmid()         { return vmid; }
    public String  getName()         { return name; }
    public int     getCpuCores()     { return cpuCores; }
    public long    getMemoryMB()     { return memoryMB; }
    public double  getStorageGB()    { return storageGB; }
    public Long    getSourceHostId() { return sourceHostId; }
    public String  getJobId()        { return jobId; }
    public Instant getCreatedAt()    { return createdAt; }
}
