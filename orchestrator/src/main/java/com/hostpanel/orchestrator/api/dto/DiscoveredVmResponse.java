package com.hostpanel.orchestrator.api.dto;

import com.hostpanel.orchestrator.model.DiscoveredVm;
import com.hostpanel.orchestrator.model.DiskInfo;
import com.hostpanel.orchestrator.model.NetworkAdapter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of one inventory entry returned by the source-host endpoints.
 */
public record DiscoveredVmResponse(
        String               name,
        String               vmPath,
        String               powerState,
        int                  cpuCores,
        long                 memoryMB,
        double               diskGB,
        String               guestOS,
        List<DiskInfo>       disks,
        List<NetworkAdapter> networkAdapters,
        Map<String, Object>  rawMetadata,
        Instant              discoveredAt
) {
    public static DiscoveredVmResponse from(DiscoveredVm vm) {
        return new DiscoveredVmResponse(
                vm.getName(),
                vm.getVmPath(),
                vm.getPowerState(),
                vm.getCpuCores(),
                vm.getMemoryMB(),
                vm.getDiskGB(),
                vm.getGuestOS(),
                vm.getDisks(),
                vm.getNetworkAdapters(),
                vm.getRawMetadata(),
                vm.getDiscoveredAt()
        );
    }
}
