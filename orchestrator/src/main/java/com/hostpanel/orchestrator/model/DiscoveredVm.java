package com.hostpanel.orchestrator.model;

import com.hostpanel.orchestrator.model.json.DiskInfoListConverter;
import com.hostpanel.orchestrator.model.json.JsonMapConverter;
import com.hostpanel.orchestrator.model.json.NetworkAdapterListConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized snapshot of one VM on a source host.
 *
 * Rows are owned by the source host, not by any job: a discovery run replaces
 * the whole set for its host, and migration jobs read it afterwards.
 * {@code position} keeps the order in which the source listed the VMs.
 *
 * DB table: discovered_vms  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "discovered_vms")
public class DiscoveredVm {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_host_id", nullable = false)
    private Long sourceHostId;

    @Column(nullable = false)
    private int position;

    @Column(nullable = false)
    private String name;

    @Column(name = "vm_path")
    private String vmPath;

    @Column(name = "power_state")
    private String powerState;

    @Column(name = "cpu_cores", nullable = false)
    private int cpuCores;

    @Column(name = "memory_mb", nullable = false)
    private long memoryMB;

    @Column(name = "disk_gb", nullable = false)
    private double diskGB;

    @Column(name = "guest_os")
    private String guestOS;

    @Convert(converter = DiskInfoListConverter.class)
    @Column(name = "disks", columnDefinition = "TEXT")
    private List<DiskInfo> disks = new ArrayList<>();

    @Convert(converter = NetworkAdapterListConverter.class)
    @Column(name = "network_adapters", columnDefinition = "TEXT")
    private List<NetworkAdapter> networkAdapters = new ArrayList<>();

    // Source-specific fields not modelled above (uuid, hw version, tools state…).
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "raw_metadata", columnDefinition = "TEXT")
    private Map<String, Object> rawMetadata = new LinkedHashMap<>();

    @Column(name = "discovered_at", nullable = false)
    private Instant discoveredAt = Instant.now();

    protected DiscoveredVm() {}   // required by JPA

    public DiscoveredVm(String name, String vmPath, String powerState, int cpuCores, long memoryMB,
                        String guestOS, List<DiskInfo> disks, List<NetworkAdapter> networkAdapters,
                        Map<String, Object> rawMetadata) {
        this.name            = name;
        this.vmPath          = vmPath;
        this.powerState      = powerState;
        this.cpuCores        = cpuCores;
        this.memoryMB        = memoryMB;
        this.guestOS         = guestOS;
        this.disks           = new ArrayList<>(disks);
        this.networkAdapters = new ArrayList<>(networkAdapters);
        this.rawMetadata     = new LinkedHashMap<>(rawMetadata);
        this.diskGB          = Math.round(disks.stream().mapToDouble(DiskInfo::sizeGB).sum() * 100) / 100.0;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long                 getId()              { return id; }
    public Long                 getSourceHostId()    { return sourceHostId; }
    public int                  getPosition()        { return position; }
    public String               getName()            { return name; }
    public String               getVmPath()          { return vmPath; }
    public String               getPowerState()      { return powerState; }
    public int                  getCpuCores()        { return cpuCores; }
    public long                 getMemoryMB()        { return memoryMB; }
    public double               getDiskGB()          { return diskGB; }
    public String               getGuestOS()         { return guestOS; }
    public List<DiskInfo>       getDisks()           { return disks; }
    public List<NetworkAdapter> getNetworkAdapters() { return networkAdapters; }
    public Map<String, Object>  getRawMetadata()     { return rawMetadata; }
    public Instant              getDiscoveredAt()    { return discoveredAt; }

    public void assignTo(Long sourceHostId, int position) {
        this.sourceHostId = sourceHostId;
        this.position     = position;
    }
}
